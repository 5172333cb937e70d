package com.kingsfoil.kingsfoil.version;

public class VersionNotCompletedException extends IllegalStateException {

    public VersionNotCompletedException(VersionKey key, VersionStatus status) {
        super(VersionConstants.MSG_VERSION_NOT_COMPLETED.formatted(key, status));
    }
}
