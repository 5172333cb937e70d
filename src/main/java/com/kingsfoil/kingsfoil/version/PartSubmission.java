package com.kingsfoil.kingsfoil.version;

import com.kingsfoil.kingsfoil.ingest.ValidationIssue;

import java.util.List;

/**
 * Outcome of handing one part to the version manager. {@code versionIssues} holds issues raised at
 * version level, such as cross-part duplicates, on top of the part's own row issues.
 */
public record PartSubmission(DataVersion version, AssemblyStatus assembly, List<ValidationIssue> versionIssues) {

    public PartSubmission {
        versionIssues = versionIssues == null ? List.of() : List.copyOf(versionIssues);
    }

    public boolean failed() {
        return version.status() == VersionStatus.FAILED;
    }
}
