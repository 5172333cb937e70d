package com.kingsfoil.kingsfoil.source;

public enum SpecialValueKind {
    /** A literal {@code *} means "no value", e.g. an edit that has not been deleted. */
    STAR_AS_NULL,
    /** A literal {@code *} marks the flag as set; a blank cell means not set. */
    STAR_AS_TRUE,
    /** Zero is a meaningful value; integral decimals like {@code 0.0} are accepted for integers. */
    PRESERVE_ZERO,
    /** The value is group 1 of {@code pattern} applied to the raw cell. */
    PATTERN_EXTRACT,
    /** Code column compared case-insensitively: the value is upper-cased, so {@code g0439} is stored as {@code G0439}. */
    UPPERCASE_CODE
}
