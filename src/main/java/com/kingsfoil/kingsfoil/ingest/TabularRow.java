package com.kingsfoil.kingsfoil.ingest;

import java.util.List;

/**
 * One physical row of an uploaded file as raw text cells, with its 1-based line number.
 */
public record TabularRow(int lineNumber, List<String> cells) {

    public TabularRow {
        cells = cells == null ? List.of() : List.copyOf(cells);
    }

    /**
     * Returns the cell at {@code index}, or null when the row is shorter.
     */
    public String cell(int index) {
        return index >= 0 && index < cells.size() ? cells.get(index) : null;
    }

    /**
     * Share of blank cells across {@code width} columns; cells missing from a short row count as blank.
     */
    public double blankRatio(int width) {
        int columns = Math.max(width, cells.size());
        if (columns == 0) {
            return 1.0;
        }
        int blank = columns - cells.size();
        for (String cell : cells) {
            if (cell == null || cell.isBlank()) {
                blank++;
            }
        }
        return (double) blank / columns;
    }
}
