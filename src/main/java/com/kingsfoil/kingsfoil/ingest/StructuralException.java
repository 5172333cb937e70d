package com.kingsfoil.kingsfoil.ingest;

import java.util.List;

/**
 * Raised when a file cannot be ingested at all: unreadable content, no header row with every
 * required column, or no data rows. Nothing from the file is accepted.
 */
public class StructuralException extends IllegalArgumentException {

    private final transient List<ValidationIssue> issues;

    public StructuralException(String message) {
        this(message, List.of());
    }

    public StructuralException(String message, List<ValidationIssue> issues) {
        super(message);
        this.issues = List.copyOf(issues);
    }

    public StructuralException(String message, Throwable cause) {
        super(message, cause);
        this.issues = List.of();
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }
}
