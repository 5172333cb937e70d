package com.kingsfoil.kingsfoil.ingest;

/**
 * One problem found while ingesting. {@code rowReference} and {@code column} are null for file- and
 * version-level issues.
 */
public record ValidationIssue(
        RowReference rowReference,
        String column,
        IssueKind kind,
        IssueSeverity severity,
        String message
) {

    public static ValidationIssue warning(RowReference reference, String column, IssueKind kind, String message) {
        return new ValidationIssue(reference, column, kind, IssueSeverity.WARNING, message);
    }

    public static ValidationIssue rejected(RowReference reference, String column, IssueKind kind, String message) {
        return new ValidationIssue(reference, column, kind, IssueSeverity.REJECTED, message);
    }

    public static ValidationIssue fatal(RowReference reference, String column, IssueKind kind, String message) {
        return new ValidationIssue(reference, column, kind, IssueSeverity.FATAL, message);
    }

    public boolean rejectsRow() {
        return severity == IssueSeverity.REJECTED || severity == IssueSeverity.FATAL;
    }
}
