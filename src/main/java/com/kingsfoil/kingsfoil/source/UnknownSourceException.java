package com.kingsfoil.kingsfoil.source;

/**
 * Raised when a caller names a source code that has no registered configuration.
 */
public class UnknownSourceException extends IllegalArgumentException {

    private final String sourceCode;

    public UnknownSourceException(String sourceCode) {
        super(SourceConstants.MSG_UNKNOWN_SOURCE.formatted(sourceCode));
        this.sourceCode = sourceCode;
    }

    public String getSourceCode() {
        return sourceCode;
    }
}
