package com.kingsfoil.kingsfoil.version;

public class VersionNotFoundException extends IllegalArgumentException {

    public VersionNotFoundException(VersionKey key) {
        super(VersionConstants.MSG_VERSION_NOT_FOUND.formatted(key));
    }
}
