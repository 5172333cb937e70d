package com.kingsfoil.kingsfoil.ingest;

import java.util.List;

/**
 * Decoded rows of an uploaded file. {@code fileName} names the member actually read, which differs
 * from the upload name for ZIP archives.
 */
public record TabularContent(String fileName, List<TabularRow> rows) {

    public TabularContent {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }
}
