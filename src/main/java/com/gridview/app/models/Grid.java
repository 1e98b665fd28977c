package com.gridview.app.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Represents the document being edited:
 * - An ordered list of rows, each an ordered list of cell texts
 * - A sparse column width map that follows column inserts/deletes
 *
 * All rows have the same length once any public operation returns.
 * The one place rows may be ragged is inside a paste, which writes through
 * {@link #ensureCell(int, int)} and then calls {@link #normalize()}.
 *
 * Out-of-range coordinates are never an error: reads return empty text,
 * writes and structural edits become no-ops.
 */
public class Grid {

    // Row width used when a row is added to a grid with no rows
    public static final int FALLBACK_COLUMNS = 10;

    private List<List<String>> rows = new ArrayList<>();
    private final ColumnWidths columnWidths;

    public Grid(double defaultColumnWidth) {
        this.columnWidths = new ColumnWidths(defaultColumnWidth);
    }

    /**
     * A grid of blank cells with the given extents.
     */
    public static Grid blank(int rowCount, int columnCount, double defaultColumnWidth) {
        Grid grid = new Grid(defaultColumnWidth);
        grid.replaceRows(blankRows(rowCount, columnCount));
        return grid;
    }

    public static List<List<String>> blankRows(int rowCount, int columnCount) {
        List<List<String>> blank = new ArrayList<>(rowCount);
        for (int r = 0; r < rowCount; r++) {
            blank.add(blankRow(columnCount));
        }
        return blank;
    }

    // ------------------------
    // Extents and cell access
    // ------------------------

    public int rowCount() {
        return rows.size();
    }

    /**
     * Length of the widest row (every row, once normalized).
     */
    public int columnCount() {
        int max = 0;
        for (List<String> row : rows) {
            max = Math.max(max, row.size());
        }
        return max;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int rowLength(int row) {
        return hasRow(row) ? rows.get(row).size() : 0;
    }

    public boolean hasRow(int row) {
        return row >= 0 && row < rows.size();
    }

    public boolean hasCell(int row, int col) {
        return hasRow(row) && col >= 0 && col < rows.get(row).size();
    }

    /**
     * Cell text, or "" when the coordinate is outside the grid.
     */
    public String getCell(int row, int col) {
        return hasCell(row, col) ? rows.get(row).get(col) : "";
    }

    /**
     * Overwrites an existing cell. Returns false (and does nothing) when
     * the coordinate is outside the grid.
     */
    public boolean setCell(int row, int col, String value) {
        if (!hasCell(row, col)) {
            return false;
        }
        rows.get(row).set(col, value == null ? "" : value);
        return true;
    }

    /**
     * Grows the grid until (row, col) exists: rows are appended at the
     * current widest-row length, then only the target row is extended.
     * Leaves the grid ragged; callers must {@link #normalize()} afterwards.
     */
    public void ensureCell(int row, int col) {
        if (row >= rows.size()) {
            int width = columnCount();
            while (row >= rows.size()) {
                rows.add(blankRow(width));
            }
        }
        List<String> target = rows.get(row);
        while (col >= target.size()) {
            target.add("");
        }
    }

    public ColumnWidths getColumnWidths() {
        return columnWidths;
    }

    // ------------------------
    // Normalization and snapshots
    // ------------------------

    /**
     * Pads every row with empty cells up to the widest row. Never shrinks.
     */
    public void normalize() {
        int maxCols = columnCount();
        for (List<String> row : rows) {
            while (row.size() < maxCols) {
                row.add("");
            }
        }
    }

    /**
     * Replaces the whole matrix with a deep copy of the given rows, then normalizes.
     */
    public void replaceRows(List<List<String>> newRows) {
        this.rows = deepCopy(newRows);
        normalize();
    }

    /**
     * Deep copy of the matrix, used for undo snapshots and the save boundary.
     */
    public List<List<String>> snapshot() {
        return deepCopy(rows);
    }

    // ------------------------
    // Structural edits
    // ------------------------

    public void addRow() {
        int cols = rows.isEmpty() ? FALLBACK_COLUMNS : rows.get(0).size();
        rows.add(blankRow(cols));
    }

    public void addColumn() {
        if (rows.isEmpty()) {
            rows.add(blankRow(1));
            return;
        }
        for (List<String> row : rows) {
            row.add("");
        }
    }

    /**
     * Inserts a blank row at index r (r == rowCount appends).
     */
    public boolean insertRowAt(int r) {
        if (r < 0 || r > rows.size()) {
            return false;
        }
        int cols = rows.isEmpty() ? FALLBACK_COLUMNS : rows.get(0).size();
        rows.add(r, blankRow(cols));
        return true;
    }

    /**
     * Inserts a blank cell at index c in every row (c == columnCount appends)
     * and shifts column widths right.
     */
    public boolean insertColumnAt(int c) {
        if (c < 0 || c > columnCount()) {
            return false;
        }
        if (rows.isEmpty()) {
            rows.add(blankRow(1));
        } else {
            for (List<String> row : rows) {
                row.add(Math.min(c, row.size()), "");
            }
        }
        columnWidths.shiftForInsert(c);
        return true;
    }

    public boolean deleteRow(int r) {
        if (!hasRow(r)) {
            return false;
        }
        rows.remove(r);
        return true;
    }

    /**
     * Removes the cell at c from every row long enough to have one, and
     * drops/shifts the column width map.
     */
    public boolean deleteColumn(int c) {
        if (c < 0 || c >= columnCount()) {
            return false;
        }
        for (List<String> row : rows) {
            if (c < row.size()) {
                row.remove(c);
            }
        }
        columnWidths.shiftForDelete(c);
        return true;
    }

    private static List<String> blankRow(int cols) {
        List<String> row = new ArrayList<>(cols);
        for (int c = 0; c < cols; c++) {
            row.add("");
        }
        return row;
    }

    static List<List<String>> deepCopy(List<List<String>> source) {
        List<List<String>> copy = new ArrayList<>(source.size());
        for (List<String> row : source) {
            List<String> rowCopy = new ArrayList<>(row.size());
            for (String cell : row) {
                rowCopy.add(cell == null ? "" : cell);
            }
            copy.add(rowCopy);
        }
        return copy;
    }
}
