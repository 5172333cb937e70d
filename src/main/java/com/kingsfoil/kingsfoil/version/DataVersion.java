package com.kingsfoil.kingsfoil.version;

import java.util.List;

/**
 * Metadata of one logical version of a source's rows. Timestamps are epoch milliseconds.
 */
public record DataVersion(
        long versionId,
        String sourceCode,
        String variant,
        String versionLabel,
        VersionStatus status,
        int recordCount,
        int partCountExpected,
        List<Integer> partsReceived,
        boolean current,
        long createdAt,
        Long lastPartAt,
        Long importedAt,
        String errorMessage
) {

    public DataVersion {
        partsReceived = partsReceived == null ? List.of() : List.copyOf(partsReceived);
    }

    public VersionKey key() {
        return new VersionKey(sourceCode, variant, versionLabel);
    }
}
