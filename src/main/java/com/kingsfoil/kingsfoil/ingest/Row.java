package com.kingsfoil.kingsfoil.ingest;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed, validated record keyed by canonical column name. Values are {@code String}, {@code Long},
 * {@code BigDecimal}, {@code LocalDate}, {@code Boolean} or null.
 */
public record Row(Map<String, Object> values, RowReference reference) {

    public Row {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Object get(String column) {
        return values.get(column);
    }

    /**
     * Returns the unique-key tuple of this row. Nulls compare equal to each other and decimals
     * compare by numeric value, so {@code 1.50} and {@code 1.5} collide.
     */
    public List<Object> keyOf(List<String> keyColumns) {
        List<Object> key = new ArrayList<>(keyColumns.size());
        for (String column : keyColumns) {
            Object value = values.get(column);
            if (value instanceof BigDecimal decimal) {
                value = decimal.signum() == 0 ? BigDecimal.ZERO : decimal.stripTrailingZeros();
            }
            key.add(value);
        }
        return key;
    }
}
