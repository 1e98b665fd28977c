package com.gridview.app.services;

import com.gridview.app.config.GridProperties;
import com.gridview.app.exceptions.ClipboardUnavailableException;
import com.gridview.app.exceptions.MalformedDocumentException;
import com.gridview.app.exceptions.SessionNotFoundException;
import com.gridview.app.models.CellPosition;
import com.gridview.app.models.EditorSession;
import com.gridview.app.models.Selection;
import com.gridview.app.models.SortIndicator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the editing operations, using an in-memory session
 * (no HTTP or external server).
 */
class EditorSessionServiceTest {

    private EditorSessionService service;
    private long sessionId;

    @BeforeEach
    void setUp() {
        service = new EditorSessionService();
        sessionId = service.createSession(List.of(
                List.of("a", "b"),
                List.of("c", "d")));
    }

    private List<List<String>> rows() {
        return service.exportRows(sessionId);
    }

    private EditorSession session() {
        return service.getSession(sessionId);
    }

    @Test
    void testDefaultSessionIs20By10() {
        long id = service.createSession();
        assertEquals(20, service.view(id).getRowCount());
        assertEquals(10, service.view(id).getColumnCount());
        assertFalse(service.view(id).isDirty());
    }

    @Test
    void testUnknownSessionThrows() {
        assertThrows(SessionNotFoundException.class, () -> service.view(9_999_999L));
        service.closeSession(sessionId);
        assertThrows(SessionNotFoundException.class, () -> service.undo(sessionId));
    }

    // ------------------------
    // Edit session
    // ------------------------

    @Test
    void testBeginEditSeedsBufferAndClearsSelection() {
        service.select(sessionId, Selection.cell(0, 0));
        service.beginEdit(sessionId, 1, 1);

        assertEquals(new CellPosition(1, 1), session().getEditSession().getEditingCell());
        assertEquals("d", session().getEditSession().getBuffer());
        assertEquals(Selection.none(), session().getSelection());
    }

    @Test
    void testTypingOnSingleSelectedCellStartsEditWithTypedText() {
        service.select(sessionId, Selection.cell(0, 1));
        service.typeText(sessionId, "x");
        service.typeText(sessionId, "y");

        assertEquals(new CellPosition(0, 1), session().getEditSession().getEditingCell());
        assertEquals("xy", session().getEditSession().getBuffer());
        assertEquals(Selection.none(), session().getSelection());

        service.commitEdit(sessionId);
        assertEquals("xy", rows().get(0).get(1));
        assertTrue(service.view(sessionId).isDirty());
    }

    @Test
    void testTypingOnMultiCellRangeDoesNothing() {
        service.select(sessionId, Selection.range(0, 0, 1, 1));
        service.typeText(sessionId, "x");
        assertFalse(session().getEditSession().isEditing());
    }

    @Test
    void testCancelDiscardsBuffer() {
        service.beginEdit(sessionId, 0, 0);
        service.updateEditBuffer(sessionId, "changed");
        service.cancelEdit(sessionId);

        assertEquals("a", rows().get(0).get(0));
        assertFalse(session().getEditSession().isEditing());
        assertFalse(service.view(sessionId).isDirty());
    }

    /**
     * Starting an edit elsewhere commits, never discards, the one in flight.
     */
    @Test
    void testSwitchingCellsCommitsPendingEdit() {
        service.beginEdit(sessionId, 0, 0);
        service.updateEditBuffer(sessionId, "kept");
        service.beginEdit(sessionId, 1, 1);

        assertEquals("kept", rows().get(0).get(0));
        assertEquals(new CellPosition(1, 1), session().getEditSession().getEditingCell());
    }

    @Test
    void testSelectingCommitsPendingEdit() {
        service.beginEdit(sessionId, 1, 0);
        service.updateEditBuffer(sessionId, "  padded ");
        service.select(sessionId, Selection.cell(0, 0));

        assertEquals("  padded ", rows().get(1).get(0));
    }

    @Test
    void testConfirmCommitsAndMovesDown() {
        service.beginEdit(sessionId, 0, 1);
        service.updateEditBuffer(sessionId, "B");
        service.confirmEdit(sessionId);

        assertEquals("B", rows().get(0).get(1));
        assertEquals(Selection.cell(1, 1), session().getSelection());

        // Bottom row: stays on the last row
        service.beginEdit(sessionId, 1, 1);
        service.confirmEdit(sessionId);
        assertEquals(Selection.cell(1, 1), session().getSelection());
    }

    /**
     * A committed edit is not its own undo step: undo goes back to the
     * snapshot before the previous mutating operation.
     */
    @Test
    void testCommitDoesNotSnapshot() {
        service.beginEdit(sessionId, 0, 0);
        service.updateEditBuffer(sessionId, "edited");
        service.commitEdit(sessionId);
        assertEquals(0, session().getHistory().undoDepth());

        service.undo(sessionId);
        assertEquals("edited", rows().get(0).get(0));
    }

    @Test
    void testBeginEditOutOfRangeIsNoOp() {
        service.beginEdit(sessionId, 5, 5);
        assertFalse(session().getEditSession().isEditing());
    }

    // ------------------------
    // Navigation
    // ------------------------

    @Test
    void testMoveClampsAndExtends() {
        service.select(sessionId, Selection.cell(0, 0));
        service.move(sessionId, 1, 0, false);
        assertEquals(Selection.cell(1, 0), session().getSelection());

        service.move(sessionId, 5, 5, false);
        assertEquals(Selection.cell(1, 1), session().getSelection());

        service.select(sessionId, Selection.cell(0, 0));
        service.move(sessionId, 0, 1, true);
        assertEquals(Selection.range(0, 0, 0, 1), session().getSelection());
        service.move(sessionId, 1, 0, true);
        assertEquals(Selection.range(0, 0, 1, 1), session().getSelection());
    }

    @Test
    void testMoveIgnoredWhileEditing() {
        service.beginEdit(sessionId, 0, 0);
        service.move(sessionId, 1, 0, false);
        assertTrue(session().getEditSession().isEditing());
        assertEquals(Selection.none(), session().getSelection());
    }

    @Test
    void testSelectAll() {
        service.selectAll(sessionId);
        assertEquals(Selection.range(0, 0, 1, 1), session().getSelection());

        long empty = service.createSession(List.of());
        service.selectAll(empty);
        assertEquals(Selection.none(), service.getSession(empty).getSelection());
    }

    @Test
    void testSelectionIsFittedToGrid() {
        service.select(sessionId, Selection.cell(1_000_000, 0));
        assertEquals(Selection.cell(1, 0), session().getSelection());

        service.select(sessionId, Selection.range(-3, 5, 0, 0));
        assertEquals(Selection.range(0, 1, 0, 0), session().getSelection());

        service.select(sessionId, Selection.column(2));
        assertEquals(Selection.range(0, 1, 0, 0), session().getSelection());
        service.select(sessionId, Selection.row(-1));
        assertEquals(Selection.range(0, 1, 0, 0), session().getSelection());
    }

    /**
     * A far-off selection must not make a paste grow the grid by that much.
     */
    @Test
    void testPasteAfterFarSelectionStaysNearGrid() {
        service.select(sessionId, Selection.cell(1_000_000, 0));
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> service.paste(sessionId, "x"));
        assertEquals(List.of(List.of("a", "b"), List.of("x", "d")), rows());
    }

    // ------------------------
    // Clipboard
    // ------------------------

    @Test
    void testCopyRange() {
        service.select(sessionId, Selection.range(0, 0, 1, 1));
        assertEquals("a\tb\nc\td", service.copy(sessionId));
    }

    @Test
    void testCutClearsAndIsUndoable() {
        service.select(sessionId, Selection.row(0));
        assertEquals("a\tb", service.cut(sessionId));
        assertEquals(List.of("", ""), rows().get(0));

        service.undo(sessionId);
        assertEquals(List.of("a", "b"), rows().get(0));
    }

    @Test
    void testCutWithNothingSelectedDoesNotSnapshot() {
        assertEquals("", service.cut(sessionId));
        assertEquals(0, session().getHistory().undoDepth());
    }

    @Test
    void testPasteAtSelectionAnchorGrowsGrid() {
        service.select(sessionId, Selection.cell(1, 1));
        service.paste(sessionId, "1\t2\n3\t4");

        assertEquals(List.of(
                List.of("a", "b", ""),
                List.of("c", "1", "2"),
                List.of("", "3", "4")), rows());
    }

    @Test
    void testPasteUsesClipboardTransport() {
        service.select(sessionId, Selection.column(0));
        service.copy(sessionId);
        service.select(sessionId, Selection.column(1));
        service.pasteFromClipboard(sessionId);

        assertEquals(List.of(List.of("a", "a"), List.of("c", "c")), rows());
    }

    @Test
    void testClipboardFailureIsIgnored() {
        ClipboardTransport broken = new ClipboardTransport() {
            @Override
            public void setText(String text) {
                throw new ClipboardUnavailableException("no display");
            }

            @Override
            public String getText() {
                throw new ClipboardUnavailableException("no display");
            }
        };
        EditorSessionService withBrokenClipboard = new EditorSessionService(new GridProperties(),
                new ClipboardCodec(), new SearchIndex(), new ColumnSorter(), new DocumentCodec(), broken);
        long id = withBrokenClipboard.createSession(List.of(List.of("x", "y")));
        withBrokenClipboard.select(id, Selection.row(0));

        assertEquals("x\ty", withBrokenClipboard.copy(id));
        assertDoesNotThrow(() -> withBrokenClipboard.pasteFromClipboard(id));
        assertEquals(List.of(List.of("x", "y")), withBrokenClipboard.exportRows(id));
    }

    @Test
    void testDeleteKeyClearsSelection() {
        service.select(sessionId, Selection.column(1));
        service.clearSelectedCells(sessionId);
        assertEquals(List.of(List.of("a", ""), List.of("c", "")), rows());
        assertEquals(1, session().getHistory().undoDepth());
    }

    @Test
    void testClearCell() {
        service.clearCell(sessionId, 1, 0);
        assertEquals("", rows().get(1).get(0));
        service.clearCell(sessionId, 7, 7);
        assertEquals(1, session().getHistory().undoDepth());
    }

    // ------------------------
    // Undo / redo
    // ------------------------

    @Test
    void testUndoRedoRestoresExactStates() {
        List<List<String>> s0 = rows();
        service.insertRowAt(sessionId, 0);
        List<List<String>> s1 = rows();
        service.deleteColumn(sessionId, 1);
        List<List<String>> s2 = rows();

        service.undo(sessionId);
        assertEquals(s1, rows());
        service.undo(sessionId);
        assertEquals(s0, rows());
        service.redo(sessionId);
        assertEquals(s1, rows());
        service.redo(sessionId);
        assertEquals(s2, rows());
    }

    @Test
    void testNewMutationAfterUndoDiscardsRedo() {
        service.addRow(sessionId);
        service.undo(sessionId);
        assertEquals(1, session().getHistory().redoDepth());

        service.addColumn(sessionId);
        assertEquals(0, session().getHistory().redoDepth());
        List<List<String>> before = rows();
        service.redo(sessionId);
        assertEquals(before, rows());
    }

    @Test
    void testUndoDepthIsBounded() {
        for (int i = 0; i < 51; i++) {
            service.addRow(sessionId);
        }
        assertEquals(50, session().getHistory().undoDepth());
    }

    @Test
    void testUndoWithEmptyHistoryIsNoOp() {
        service.undo(sessionId);
        service.redo(sessionId);
        assertEquals(List.of(List.of("a", "b"), List.of("c", "d")), rows());
        assertFalse(service.view(sessionId).isDirty());
    }

    // ------------------------
    // Structural edits
    // ------------------------

    @Test
    void testStructuralEditsTrackEditingCell() {
        service.beginEdit(sessionId, 1, 1);
        service.insertRowAt(sessionId, 0);
        service.insertColumnAt(sessionId, 0);
        assertEquals(new CellPosition(2, 2), session().getEditSession().getEditingCell());

        service.deleteRow(sessionId, 0);
        assertEquals(new CellPosition(1, 2), session().getEditSession().getEditingCell());

        service.deleteColumn(sessionId, 2);
        assertFalse(session().getEditSession().isEditing());
    }

    @Test
    void testOutOfRangeStructuralEditsAreNoOps() {
        service.deleteRow(sessionId, 2);
        service.deleteColumn(sessionId, -1);
        service.insertRowAt(sessionId, 3);
        service.insertColumnAt(sessionId, 3);
        assertEquals(List.of(List.of("a", "b"), List.of("c", "d")), rows());
        assertEquals(0, session().getHistory().undoDepth());
    }

    @Test
    void testColumnWidthsFollowColumns() {
        service.setColumnWidth(sessionId, 1, 250.0);
        service.insertColumnAt(sessionId, 1);
        assertEquals(250.0, service.columnWidth(sessionId, 2));
        assertEquals(120.0, service.columnWidth(sessionId, 1));

        service.deleteColumn(sessionId, 2);
        assertEquals(120.0, service.columnWidth(sessionId, 2));
    }

    // ------------------------
    // Search and sort
    // ------------------------

    @Test
    void testSearchAndCycle() {
        long id = service.createSession(List.of(List.of("cat", "dog"), List.of("Cattle", "bird")));
        assertEquals(List.of(new CellPosition(0, 0), new CellPosition(1, 0)), service.search(id, "cat", false));
        assertEquals("cat", service.view(id).getSearchQuery());
        assertFalse(service.view(id).isSearchCaseSensitive());

        assertEquals(Optional.of(new CellPosition(1, 0)), service.nextResult(id));
        assertEquals(Selection.cell(1, 0), service.getSession(id).getSelection());
        assertEquals(Optional.of(new CellPosition(0, 0)), service.nextResult(id));
        assertEquals(Optional.of(new CellPosition(1, 0)), service.prevResult(id));
    }

    @Test
    void testSearchNavigationCommitsEdit() {
        service.search(sessionId, "d", true);
        service.beginEdit(sessionId, 0, 0);
        service.updateEditBuffer(sessionId, "typed");
        service.nextResult(sessionId);

        assertEquals("typed", rows().get(0).get(0));
        assertFalse(session().getEditSession().isEditing());
        assertEquals(Selection.cell(1, 1), session().getSelection());
    }

    @Test
    void testSortIsUndoableAndSetsIndicator() {
        long id = service.createSession(List.of(List.of("3"), List.of("1"), List.of("2")));
        service.sortByColumn(id, 0, true);

        assertEquals(List.of(List.of("1"), List.of("2"), List.of("3")), service.exportRows(id));
        assertEquals(new SortIndicator(0, true), service.view(id).getSortIndicator());

        service.undo(id);
        assertEquals(List.of(List.of("3"), List.of("1"), List.of("2")), service.exportRows(id));
        assertNull(service.view(id).getSortIndicator());
    }

    @Test
    void testSortWithFrozenHeader() {
        long id = service.createSession(List.of(List.of("name"), List.of("b"), List.of("a")));
        service.setFrozenHeader(id, true);
        service.sortByColumn(id, 0, true);
        assertEquals(List.of(List.of("name"), List.of("a"), List.of("b")), service.exportRows(id));
    }

    @Test
    void testEditClearsSortIndicator() {
        service.sortByColumn(sessionId, 0, false);
        assertNotNull(service.view(sessionId).getSortIndicator());

        service.beginEdit(sessionId, 0, 0);
        service.commitEdit(sessionId);
        assertNull(service.view(sessionId).getSortIndicator());
    }

    // ------------------------
    // Documents
    // ------------------------

    @Test
    void testLoadDocumentReplacesGridAndResetsState() {
        service.addRow(sessionId);
        service.select(sessionId, Selection.cell(0, 0));
        service.loadDocument(sessionId, "h1,h2,h3\n1,2\n".getBytes(StandardCharsets.UTF_8), "data.csv");

        assertEquals(List.of(List.of("h1", "h2", "h3"), List.of("1", "2", "")), rows());
        assertEquals(0, session().getHistory().undoDepth());
        assertEquals(Selection.none(), session().getSelection());
        assertEquals("data.csv", service.view(sessionId).getDocumentName());
        assertFalse(service.view(sessionId).isDirty());
    }

    @Test
    void testMalformedLoadLeavesGridUntouched() {
        byte[] bad = {(byte) 0xFF, (byte) 0xFE, (byte) 0xC3};
        assertThrows(MalformedDocumentException.class, () -> service.loadDocument(sessionId, bad, "bad.csv"));
        assertEquals(List.of(List.of("a", "b"), List.of("c", "d")), rows());
    }

    @Test
    void testPendingDocumentIsConsumedOnce() {
        assertFalse(service.pollPendingDocument(sessionId));

        service.offerDocument(sessionId, "old\n".getBytes(StandardCharsets.UTF_8), "old.csv");
        service.offerDocument(sessionId, "x,y\n".getBytes(StandardCharsets.UTF_8), "new.csv");

        assertTrue(service.pollPendingDocument(sessionId));
        assertEquals(List.of(List.of("x", "y")), rows());
        assertEquals("new.csv", service.view(sessionId).getDocumentName());
        assertFalse(service.pollPendingDocument(sessionId));
    }

    @Test
    void testSaveMarksClean() {
        service.addRow(sessionId);
        assertTrue(service.view(sessionId).isDirty());

        byte[] bytes = service.saveDocument(sessionId);
        assertFalse(service.view(sessionId).isDirty());
        assertEquals(rows(), new DocumentCodec().decode(bytes, "saved.csv"));
    }

    @Test
    void testNewDocument() {
        service.addRow(sessionId);
        service.newDocument(sessionId);
        assertEquals(20, service.view(sessionId).getRowCount());
        assertEquals(10, service.view(sessionId).getColumnCount());
        assertEquals(0, session().getHistory().undoDepth());
        assertFalse(service.view(sessionId).isDirty());
    }

    /**
     * Any sequence of operations leaves every row the same length.
     */
    @Test
    void testGridStaysRectangular() {
        service.select(sessionId, Selection.cell(3, 4));
        service.paste(sessionId, "1\n2\t3\t4\t5\n6");
        service.insertColumnAt(sessionId, 2);
        service.deleteRow(sessionId, 0);
        service.addRow(sessionId);
        service.select(sessionId, Selection.row(1));
        service.cut(sessionId);
        service.undo(sessionId);

        List<List<String>> rows = rows();
        int width = rows.get(0).size();
        for (List<String> row : rows) {
            assertEquals(width, row.size());
        }
    }
}
