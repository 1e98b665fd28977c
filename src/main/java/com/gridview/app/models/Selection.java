package com.gridview.app.models;

/**
 * The highlighted region of the grid. Exactly one of:
 * - {@link None}: nothing selected
 * - {@link CellRange}: a rectangle given by two corners in any order
 * - {@link Column}: every row's cell at one column
 * - {@link Row}: every cell of one row
 *
 * A single selected cell is a CellRange whose corners are equal.
 */
public sealed interface Selection permits Selection.None, Selection.CellRange, Selection.Column, Selection.Row {

    Selection NONE = new None();

    static Selection none() {
        return NONE;
    }

    static CellRange cell(int row, int col) {
        CellPosition pos = new CellPosition(row, col);
        return new CellRange(pos, pos);
    }

    static CellRange range(int startRow, int startCol, int endRow, int endCol) {
        return new CellRange(new CellPosition(startRow, startCol), new CellPosition(endRow, endCol));
    }

    static Column column(int col) {
        return new Column(col);
    }

    static Row row(int row) {
        return new Row(row);
    }

    /**
     * Rectangle covered by this selection. Column and Row selections span
     * the grid's full extent on the other axis.
     */
    SelectionBounds normalizedBounds(Grid grid);

    /**
     * Whether (row, col) belongs to this selection. Clearing and text
     * extraction include exactly the cells for which this returns true.
     */
    boolean contains(Grid grid, int row, int col);

    /**
     * Top-left cell a paste into this selection starts at.
     */
    CellPosition pasteAnchor();

    /**
     * Empties every existing cell this selection contains.
     */
    void clear(Grid grid);

    default boolean isSingleCell() {
        return false;
    }

    record None() implements Selection {

        @Override
        public SelectionBounds normalizedBounds(Grid grid) {
            return new SelectionBounds(0, -1, 0, -1);
        }

        @Override
        public boolean contains(Grid grid, int row, int col) {
            return false;
        }

        @Override
        public CellPosition pasteAnchor() {
            return new CellPosition(0, 0);
        }

        @Override
        public void clear(Grid grid) {
        }
    }

    record CellRange(CellPosition start, CellPosition end) implements Selection {

        public SelectionBounds bounds() {
            return SelectionBounds.between(start, end);
        }

        @Override
        public SelectionBounds normalizedBounds(Grid grid) {
            return bounds();
        }

        @Override
        public boolean contains(Grid grid, int row, int col) {
            return bounds().contains(row, col);
        }

        @Override
        public CellPosition pasteAnchor() {
            return bounds().topLeft();
        }

        @Override
        public void clear(Grid grid) {
            SelectionBounds b = bounds();
            int lastRow = Math.min(b.maxRow(), grid.rowCount() - 1);
            for (int r = Math.max(b.minRow(), 0); r <= lastRow; r++) {
                int lastCol = Math.min(b.maxCol(), grid.rowLength(r) - 1);
                for (int c = Math.max(b.minCol(), 0); c <= lastCol; c++) {
                    grid.setCell(r, c, "");
                }
            }
        }

        @Override
        public boolean isSingleCell() {
            return start.equals(end);
        }
    }

    record Column(int index) implements Selection {

        @Override
        public SelectionBounds normalizedBounds(Grid grid) {
            return new SelectionBounds(0, grid.rowCount() - 1, index, index);
        }

        @Override
        public boolean contains(Grid grid, int row, int col) {
            return col == index && grid.hasRow(row);
        }

        @Override
        public CellPosition pasteAnchor() {
            return new CellPosition(0, index);
        }

        @Override
        public void clear(Grid grid) {
            for (int r = 0; r < grid.rowCount(); r++) {
                grid.setCell(r, index, "");
            }
        }
    }

    record Row(int index) implements Selection {

        @Override
        public SelectionBounds normalizedBounds(Grid grid) {
            return new SelectionBounds(index, index, 0, grid.columnCount() - 1);
        }

        // Only columns actually present in the row
        @Override
        public boolean contains(Grid grid, int row, int col) {
            return row == index && grid.hasCell(row, col);
        }

        @Override
        public CellPosition pasteAnchor() {
            return new CellPosition(index, 0);
        }

        @Override
        public void clear(Grid grid) {
            for (int c = 0; c < grid.rowLength(index); c++) {
                grid.setCell(index, c, "");
            }
        }
    }
}
