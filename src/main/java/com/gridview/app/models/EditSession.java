package com.gridview.app.models;

/**
 * Single-cell edit buffer. Either idle, or editing one (row, col) with a
 * text buffer that is written back to the grid on commit.
 *
 * The edited coordinate is tracked across structural edits: inserting a
 * row/column at or before it moves it, deleting its own row/column ends
 * the edit without writing.
 */
public class EditSession {

    private CellPosition editingCell;
    private String buffer = "";

    public boolean isEditing() {
        return editingCell != null;
    }

    public boolean isEditing(CellPosition cell) {
        return editingCell != null && editingCell.equals(cell);
    }

    /**
     * Cell being edited, or null when idle.
     */
    public CellPosition getEditingCell() {
        return editingCell;
    }

    public String getBuffer() {
        return buffer;
    }

    public void begin(CellPosition cell, String seed) {
        this.editingCell = cell;
        this.buffer = seed == null ? "" : seed;
    }

    public void setBuffer(String text) {
        if (isEditing()) {
            this.buffer = text == null ? "" : text;
        }
    }

    /**
     * Writes the buffer verbatim into the edited cell and returns to idle.
     * Returns the cell that was written, or null if nothing was (idle, or
     * the cell no longer exists).
     */
    public CellPosition commit(Grid grid) {
        if (!isEditing()) {
            return null;
        }
        CellPosition target = editingCell;
        boolean written = grid.setCell(target.row(), target.col(), buffer);
        reset();
        return written ? target : null;
    }

    public void cancel() {
        reset();
    }

    // ------------------------
    // Index tracking
    // ------------------------

    public void onRowInserted(int r) {
        if (editingCell != null && editingCell.row() >= r) {
            editingCell = editingCell.offset(1, 0);
        }
    }

    public void onColumnInserted(int c) {
        if (editingCell != null && editingCell.col() >= c) {
            editingCell = editingCell.offset(0, 1);
        }
    }

    public void onRowDeleted(int r) {
        if (editingCell == null) {
            return;
        }
        if (editingCell.row() == r) {
            reset();
        } else if (editingCell.row() > r) {
            editingCell = editingCell.offset(-1, 0);
        }
    }

    public void onColumnDeleted(int c) {
        if (editingCell == null) {
            return;
        }
        if (editingCell.col() == c) {
            reset();
        } else if (editingCell.col() > c) {
            editingCell = editingCell.offset(0, -1);
        }
    }

    private void reset() {
        editingCell = null;
        buffer = "";
    }
}
