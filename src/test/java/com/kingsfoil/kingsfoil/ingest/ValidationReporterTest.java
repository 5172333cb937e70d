package com.kingsfoil.kingsfoil.ingest;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValidationReporterTest {

    @Test
    void shouldBreakDownRejectionsByKindAndColumn() {
        RowReference line2 = new RowReference("rvu.csv", 1, 2);
        RowReference line3 = new RowReference("rvu.csv", 1, 3);
        ValidationReporter reporter = new ValidationReporter("rvu.csv");

        reporter.recordTransformed(new TransformedRow(null, List.of(
                ValidationIssue.rejected(line2, "work_rvu", IssueKind.TYPE_ERROR, "'x' is not a number"))));
        reporter.recordTransformed(new TransformedRow(null, List.of(
                ValidationIssue.rejected(line3, "work_rvu", IssueKind.TYPE_ERROR, "'y' is not a number"),
                ValidationIssue.warning(line3, "mac_locality", IssueKind.DERIVATION_SKIPPED, "skipped"))));
        reporter.recordAccepted();
        reporter.recordAccepted();
        reporter.reject(ValidationIssue.rejected(line3, null, IssueKind.DUPLICATE_KEY, "dup"));
        reporter.recordSkipped();

        ValidationReport report = reporter.build(false);

        assertEquals(5, report.totalRows());
        assertEquals(1, report.acceptedRows());
        assertEquals(3, report.rejectedRows());
        assertEquals(1, report.skippedRows());
        assertEquals(1, report.warningCount());
        assertEquals(Map.of("work_rvu", 2), report.rejectionsByKindAndColumn().get(IssueKind.TYPE_ERROR));
        assertEquals(Map.of(ValidationReporter.NO_COLUMN, 1), report.rejectionsByKindAndColumn().get(IssueKind.DUPLICATE_KEY));
        assertFalse(report.fatal());
    }

    @Test
    void shouldMarkReportFatalWhenAnyFatalIssueIsPresent() {
        ValidationReporter reporter = new ValidationReporter("ptp.txt");
        reporter.addIssue(ValidationIssue.fatal(null, null, IssueKind.CROSS_PART_DUPLICATE, "dup across parts"));

        assertTrue(reporter.build(false).fatal());
    }
}
