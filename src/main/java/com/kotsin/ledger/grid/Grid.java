package com.kotsin.ledger.grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable snapshot of a worksheet's cell text. Rows may be ragged; any cell
 * outside a row reads as the empty string. All coordinates are 1-based.
 */
public final class Grid {

    private static final Grid EMPTY = new Grid(List.of());

    private final List<List<String>> rows;
    private final int maxColumnCount;

    private Grid(List<List<String>> rows) {
        this.rows = rows;
        this.maxColumnCount = rows.stream().mapToInt(List::size).max().orElse(0);
    }

    public static Grid of(List<? extends List<String>> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        List<List<String>> copy = new ArrayList<>(values.size());
        for (List<String> row : values) {
            List<String> r = new ArrayList<>(row == null ? 0 : row.size());
            if (row != null) {
                for (String cell : row) {
                    r.add(cell == null ? "" : cell);
                }
            }
            copy.add(Collections.unmodifiableList(r));
        }
        return new Grid(Collections.unmodifiableList(copy));
    }

    public static Grid empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int rowCount() {
        return rows.size();
    }

    public int maxColumnCount() {
        return maxColumnCount;
    }

    /** number of cells actually present in {@code row} */
    public int columnCount(int row) {
        if (row < 1 || row > rows.size()) return 0;
        return rows.get(row - 1).size();
    }

    public String cell(int row, int col) {
        if (row < 1 || row > rows.size()) return "";
        List<String> r = rows.get(row - 1);
        if (col < 1 || col > r.size()) return "";
        return r.get(col - 1);
    }
}
