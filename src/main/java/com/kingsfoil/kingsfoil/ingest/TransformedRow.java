package com.kingsfoil.kingsfoil.ingest;

import java.util.List;

/**
 * Outcome of transforming one raw record: the typed row, or null when an issue rejected it.
 */
public record TransformedRow(Row row, List<ValidationIssue> issues) {

    public TransformedRow {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public boolean accepted() {
        return row != null;
    }
}
