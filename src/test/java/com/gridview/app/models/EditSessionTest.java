package com.gridview.app.models;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EditSessionTest {

    private Grid grid;
    private EditSession edit;

    @BeforeEach
    void setUp() {
        grid = new Grid(120.0);
        grid.replaceRows(List.of(List.of("a", "b"), List.of("c", "d")));
        edit = new EditSession();
    }

    @Test
    void testCommitWritesBufferVerbatim() {
        edit.begin(new CellPosition(1, 0), "c");
        edit.setBuffer("  spaced \t text ");

        assertEquals(new CellPosition(1, 0), edit.commit(grid));
        assertEquals("  spaced \t text ", grid.getCell(1, 0));
        assertFalse(edit.isEditing());
    }

    @Test
    void testCancelLeavesCellUnchanged() {
        edit.begin(new CellPosition(0, 1), "b");
        edit.setBuffer("discarded");
        edit.cancel();

        assertFalse(edit.isEditing());
        assertNull(edit.commit(grid));
        assertEquals("b", grid.getCell(0, 1));
    }

    @Test
    void testSetBufferIgnoredWhenIdle() {
        edit.setBuffer("nothing");
        assertEquals("", edit.getBuffer());
    }

    @Test
    void testCommitToVanishedCellWritesNothing() {
        edit.begin(new CellPosition(1, 1), "d");
        grid.deleteRow(1);
        assertNull(edit.commit(grid));
        assertEquals(1, grid.rowCount());
    }

    @Test
    void testTrackedCellFollowsInserts() {
        edit.begin(new CellPosition(1, 1), "d");
        edit.onRowInserted(1);
        assertEquals(new CellPosition(2, 1), edit.getEditingCell());
        edit.onColumnInserted(2);
        assertEquals(new CellPosition(2, 1), edit.getEditingCell());
        edit.onColumnInserted(0);
        assertEquals(new CellPosition(2, 2), edit.getEditingCell());
    }

    @Test
    void testTrackedCellFollowsDeletes() {
        edit.begin(new CellPosition(2, 2), "x");
        edit.onRowDeleted(0);
        assertEquals(new CellPosition(1, 2), edit.getEditingCell());
        edit.onColumnDeleted(3);
        assertEquals(new CellPosition(1, 2), edit.getEditingCell());

        // Deleting the edited column ends the edit
        edit.onColumnDeleted(2);
        assertFalse(edit.isEditing());
    }
}
