package com.gridview.app.models;

/**
 * Inclusive rectangle of cells: minRow..=maxRow, minCol..=maxCol.
 * A bound whose max is below its min covers no cells (e.g. a column
 * selection over an empty grid).
 */
public record SelectionBounds(int minRow, int maxRow, int minCol, int maxCol) {

    public static SelectionBounds between(CellPosition a, CellPosition b) {
        return new SelectionBounds(
                Math.min(a.row(), b.row()), Math.max(a.row(), b.row()),
                Math.min(a.col(), b.col()), Math.max(a.col(), b.col()));
    }

    public boolean contains(int row, int col) {
        return row >= minRow && row <= maxRow && col >= minCol && col <= maxCol;
    }

    public boolean isEmpty() {
        return maxRow < minRow || maxCol < minCol;
    }

    public CellPosition topLeft() {
        return new CellPosition(minRow, minCol);
    }
}
