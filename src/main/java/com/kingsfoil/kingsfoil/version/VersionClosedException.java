package com.kingsfoil.kingsfoil.version;

public class VersionClosedException extends IllegalStateException {

    public VersionClosedException(VersionKey key, VersionStatus status) {
        super(VersionConstants.MSG_VERSION_CLOSED.formatted(key, status));
    }
}
