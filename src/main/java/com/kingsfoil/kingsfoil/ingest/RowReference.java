package com.kingsfoil.kingsfoil.ingest;

/**
 * Points back at the uploaded file, part and 1-based line a row or issue came from.
 */
public record RowReference(String fileName, int partIndex, int lineNumber) {

    @Override
    public String toString() {
        return fileName + "#" + partIndex + ":" + lineNumber;
    }
}
