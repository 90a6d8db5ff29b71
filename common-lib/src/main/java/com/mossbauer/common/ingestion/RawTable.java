package com.mossbauer.common.ingestion;

import java.util.List;
import java.util.Locale;

/**
 * Untyped cell grid produced by a parser. A {@code null} cell is a missing value.
 * Every row remembers its zero-based position in the uploaded file so diagnostics can
 * point at the original line after incomplete rows are dropped.
 */
record RawTable(List<Line> rows, int columnCount) {

    record Line(int sourceIndex, String[] cells) {}

    static final RawTable EMPTY = new RawTable(List.of(), 0);

    private static final List<String> MISSING_TOKENS =
        List.of("", "nan", "na", "n/a", "null", "none", "#n/a");

    static boolean isMissing(String cell) {
        return cell == null || MISSING_TOKENS.contains(cell.trim().toLowerCase(Locale.ROOT));
    }

    /** Rows in which every one of the {@code columnCount} cells is present. */
    RawTable dropMissing() {
        List<Line> complete = rows.stream()
            .filter(row -> {
                String[] cells = row.cells();
                for (int c = 0; c < columnCount; c++) {
                    if (c >= cells.length || isMissing(cells[c])) return false;
                }
                return true;
            })
            .toList();
        return new RawTable(complete, columnCount);
    }

    int rowCount() {
        return rows.size();
    }
}
