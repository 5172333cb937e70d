package com.kingsfoil.kingsfoil.ingest;

import com.kingsfoil.kingsfoil.version.AssemblyStatus;
import com.kingsfoil.kingsfoil.version.DataVersion;
import com.kingsfoil.kingsfoil.version.VersionStatus;

import java.util.List;

/**
 * Response of {@link IngestService#ingestFile}: the version's status after this part, the part's
 * accepted row count, every issue raised, assembly progress and the file report.
 */
public record IngestResult(
        VersionStatus status,
        int acceptedRows,
        List<ValidationIssue> issues,
        AssemblyStatus assembly,
        ValidationReport report,
        DataVersion version
) {

    public IngestResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
