package com.kingsfoil.kingsfoil.source;

import java.util.List;

/**
 * Source-specific convention applied to one column's raw cell before type coercion.
 * {@code pattern} and {@code allowedValues} are only read by {@link SpecialValueKind#PATTERN_EXTRACT}.
 */
public record SpecialValueRule(String column, SpecialValueKind kind, String pattern, List<String> allowedValues) {

    public SpecialValueRule {
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
    }

    public SpecialValueRule(String column, SpecialValueKind kind) {
        this(column, kind, null, List.of());
    }
}
