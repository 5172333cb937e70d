package com.kingsfoil.kingsfoil.ingest;

import java.util.List;
import java.util.Map;

/**
 * Structured account of one ingested file. {@code rejectionsByKindAndColumn} counts rejecting issues
 * per issue kind and column; {@code fatal} is set when the file or its version was aborted.
 */
public record ValidationReport(
        String fileName,
        int totalRows,
        int acceptedRows,
        int rejectedRows,
        int skippedRows,
        int warningCount,
        List<ValidationIssue> issues,
        Map<IssueKind, Map<String, Integer>> rejectionsByKindAndColumn,
        boolean fatal
) {

    public ValidationReport {
        issues = issues == null ? List.of() : List.copyOf(issues);
        rejectionsByKindAndColumn = rejectionsByKindAndColumn == null ? Map.of() : rejectionsByKindAndColumn;
    }
}
