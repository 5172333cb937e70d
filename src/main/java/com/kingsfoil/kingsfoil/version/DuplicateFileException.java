package com.kingsfoil.kingsfoil.version;

/**
 * Raised when a single-part source receives a byte-identical copy of a file already stored in a completed version.
 */
public class DuplicateFileException extends IllegalStateException {

    private final VersionKey existingVersion;

    public DuplicateFileException(PartFile file, VersionKey target, DataVersion existing) {
        super(VersionConstants.MSG_DUPLICATE_FILE.formatted(file.fileName(), target, existing.key()));
        this.existingVersion = existing.key();
    }

    public VersionKey getExistingVersion() {
        return existingVersion;
    }
}
