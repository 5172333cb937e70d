package com.kingsfoil.kingsfoil.ingest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of matching one header row against a source's aliases.
 *
 * @param columnIndexes          canonical column name to raw header index
 * @param unmatchedHeaders       raw header texts that matched no column, or repeated an already matched one
 * @param missingRequiredColumns required canonical columns no header resolved to
 */
public record HeaderResolution(
        Map<String, Integer> columnIndexes,
        List<String> unmatchedHeaders,
        List<String> missingRequiredColumns
) {

    public HeaderResolution {
        columnIndexes = Collections.unmodifiableMap(new LinkedHashMap<>(columnIndexes));
        unmatchedHeaders = List.copyOf(unmatchedHeaders);
        missingRequiredColumns = List.copyOf(missingRequiredColumns);
    }

    public boolean isComplete() {
        return missingRequiredColumns.isEmpty() && !columnIndexes.isEmpty();
    }

    public Integer indexOf(String column) {
        return columnIndexes.get(column);
    }
}
