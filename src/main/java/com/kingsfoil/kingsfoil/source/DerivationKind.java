package com.kingsfoil.kingsfoil.source;

public enum DerivationKind {
    CONCAT,
    PATTERN_EXTRACT
}
