package com.kingsfoil.kingsfoil.ingest;

import com.kingsfoil.kingsfoil.source.CanonicalColumn;
import com.kingsfoil.kingsfoil.source.DataSourceConfig;
import com.kingsfoil.kingsfoil.source.HeaderNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps raw header text to canonical columns by exact lookup of the normalized text in the source's
 * alias index. No fuzzy matching: an unknown header is reported, never guessed.
 */
@Component
public class HeaderResolver {

    public HeaderResolution resolveHeaders(List<String> rawHeaders, DataSourceConfig config) {
        Map<String, String> aliasIndex = config.aliasIndex();
        Map<String, Integer> columnIndexes = new LinkedHashMap<>();
        List<String> unmatched = new ArrayList<>();

        for (int i = 0; i < rawHeaders.size(); i++) {
            String raw = rawHeaders.get(i);
            String normalized = HeaderNormalizer.normalize(raw);
            if (normalized.isEmpty()) {
                continue;
            }
            String column = aliasIndex.get(normalized);
            if (column != null && !columnIndexes.containsKey(column)) {
                columnIndexes.put(column, i);
            } else {
                unmatched.add(raw.strip());
            }
        }

        Set<String> derived = config.derivedColumnNames();
        List<String> missing = new ArrayList<>();
        for (CanonicalColumn column : config.columns()) {
            if (column.required() && !columnIndexes.containsKey(column.name()) && !derived.contains(column.name())) {
                missing.add(column.name());
            }
        }
        return new HeaderResolution(columnIndexes, unmatched, missing);
    }

    /**
     * Finds the header row among the first {@code maxScanRows} rows: the first row that resolves every
     * required column. When none does, the row with the most matches is returned so the caller can
     * report what is missing.
     */
    public LocatedHeader locateHeaderRow(List<TabularRow> rows, DataSourceConfig config, int maxScanRows) {
        LocatedHeader best = null;
        int limit = Math.min(rows.size(), Math.max(1, maxScanRows));
        for (int position = 0; position < limit; position++) {
            TabularRow row = rows.get(position);
            HeaderResolution resolution = resolveHeaders(row.cells(), config);
            LocatedHeader candidate = new LocatedHeader(position, row, resolution);
            if (resolution.isComplete()) {
                return candidate;
            }
            if (best == null || resolution.columnIndexes().size() > best.resolution().columnIndexes().size()) {
                best = candidate;
            }
        }
        return best;
    }
}
