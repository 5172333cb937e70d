package com.kingsfoil.kingsfoil.ingest;

/**
 * Raised when a cell's text cannot be read as its column's declared type.
 */
public class CoercionException extends IllegalArgumentException {

    public CoercionException(String message) {
        super(message);
    }

    public CoercionException(String message, Throwable cause) {
        super(message, cause);
    }
}
