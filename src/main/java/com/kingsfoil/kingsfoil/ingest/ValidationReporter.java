package com.kingsfoil.kingsfoil.ingest;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the outcome of one file while it is processed and builds its {@link ValidationReport}.
 * Not thread-safe; one instance per file.
 */
public class ValidationReporter {

    /** Key used in the rejection breakdown for issues not tied to a column. */
    static final String NO_COLUMN = "(row)";

    private final String fileName;
    private final List<ValidationIssue> issues = new ArrayList<>();
    private int acceptedRows;
    private int rejectedRows;
    private int skippedRows;

    public ValidationReporter(String fileName) {
        this.fileName = fileName;
    }

    public void recordAccepted() {
        acceptedRows++;
    }

    public void recordSkipped() {
        skippedRows++;
    }

    public void addIssue(ValidationIssue issue) {
        issues.add(issue);
    }

    public void addIssues(Collection<ValidationIssue> newIssues) {
        issues.addAll(newIssues);
    }

    public void recordTransformed(TransformedRow transformed) {
        issues.addAll(transformed.issues());
        if (transformed.accepted()) {
            acceptedRows++;
        } else {
            rejectedRows++;
        }
    }

    /**
     * Moves a row that was accepted by transformation into the rejected count, for checks that run
     * after transformation such as in-file duplicate keys.
     */
    public void reject(ValidationIssue issue) {
        issues.add(issue);
        acceptedRows--;
        rejectedRows++;
    }

    public List<ValidationIssue> issues() {
        return Collections.unmodifiableList(issues);
    }

    public int acceptedRows() {
        return acceptedRows;
    }

    public int rejectedRows() {
        return rejectedRows;
    }

    public ValidationReport build(boolean fatal) {
        int warnings = 0;
        boolean anyFatal = fatal;
        Map<IssueKind, Map<String, Integer>> breakdown = new EnumMap<>(IssueKind.class);
        for (ValidationIssue issue : issues) {
            switch (issue.severity()) {
                case WARNING -> warnings++;
                case FATAL -> anyFatal = true;
                case REJECTED -> breakdown
                        .computeIfAbsent(issue.kind(), kind -> new LinkedHashMap<>())
                        .merge(issue.column() == null ? NO_COLUMN : issue.column(), 1, Integer::sum);
            }
        }
        return new ValidationReport(
                fileName,
                acceptedRows + rejectedRows + skippedRows,
                acceptedRows,
                rejectedRows,
                skippedRows,
                warnings,
                issues,
                breakdown,
                anyFatal
        );
    }
}
