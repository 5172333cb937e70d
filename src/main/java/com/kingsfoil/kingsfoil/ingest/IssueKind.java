package com.kingsfoil.kingsfoil.ingest;

public enum IssueKind {
    UNREADABLE_FILE,
    NO_DATA_ROWS,
    UNMATCHED_HEADER,
    MISSING_REQUIRED_HEADER,
    TYPE_ERROR,
    KEY_TYPE_ERROR,
    SPECIAL_VALUE_ERROR,
    MISSING_REQUIRED_VALUE,
    DERIVATION_SKIPPED,
    DUPLICATE_KEY,
    CROSS_PART_DUPLICATE,
    PART_COUNT_MISMATCH,
    ASSEMBLY_TIMEOUT,
    ASSEMBLY_LOST
}
