package com.gridview.app.models;

/**
 * A zero-based (row, column) coordinate in the grid.
 */
public record CellPosition(int row, int col) {

    public CellPosition offset(int rowDelta, int colDelta) {
        return new CellPosition(row + rowDelta, col + colDelta);
    }
}
