package com.gridview.app.services;

import com.gridview.app.config.GridProperties;
import com.gridview.app.exceptions.ClipboardUnavailableException;
import com.gridview.app.exceptions.DocumentSaveException;
import com.gridview.app.exceptions.MalformedDocumentException;
import com.gridview.app.exceptions.SessionNotFoundException;
import com.gridview.app.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Main editing logic: turns input events (select, edit, clipboard,
 * undo/redo, structural edits, search, sort, load/save) into changes on
 * one session's grid, selection, edit buffer and history.
 *
 * Every operation runs under the session's write lock, so one event is
 * fully applied before the next. Out-of-range coordinates are no-ops.
 */
@Service
public class EditorSessionService {

    private static final Logger logger = LoggerFactory.getLogger(EditorSessionService.class);

    // All sessions live here in memory; nothing is persisted across restarts
    private final Map<Long, EditorSession> sessions = new ConcurrentHashMap<>();

    private final GridProperties properties;
    private final ClipboardCodec clipboardCodec;
    private final SearchIndex searchIndex;
    private final ColumnSorter columnSorter;
    private final DocumentCodec documentCodec;
    private final ClipboardTransport clipboardTransport;

    @Autowired
    public EditorSessionService(GridProperties properties,
                                ClipboardCodec clipboardCodec,
                                SearchIndex searchIndex,
                                ColumnSorter columnSorter,
                                DocumentCodec documentCodec,
                                ClipboardTransport clipboardTransport) {
        this.properties = properties;
        this.clipboardCodec = clipboardCodec;
        this.searchIndex = searchIndex;
        this.columnSorter = columnSorter;
        this.documentCodec = documentCodec;
        this.clipboardTransport = clipboardTransport;
    }

    /**
     * Default configuration and an in-process clipboard.
     */
    public EditorSessionService() {
        this(new GridProperties(), new ClipboardCodec(), new SearchIndex(), new ColumnSorter(),
                new DocumentCodec(), new InMemoryClipboardTransport());
    }

    // ----------------------------------------------------------------
    // Session lifecycle
    // ----------------------------------------------------------------

    /**
     * Creates a session holding a blank grid of the default extents.
     */
    public long createSession() {
        return createSession(Grid.blankRows(properties.getDefaultRows(), properties.getDefaultColumns()));
    }

    /**
     * Creates a session whose grid is loaded from {@code rows} (normalized).
     */
    public long createSession(List<List<String>> rows) {
        Grid grid = new Grid(properties.getDefaultColumnWidth());
        grid.replaceRows(rows);
        EditorSession session = new EditorSession(grid,
                new UndoHistory(properties.getHistoryDepth()), properties.isFrozenHeader());
        sessions.put(session.getId(), session);
        logger.info("Created session {} with {}x{} grid", session.getId(), grid.rowCount(), grid.columnCount());
        return session.getId();
    }

    /**
     * Retrieves a session by ID. Throws if not found.
     */
    public EditorSession getSession(long sessionId) {
        EditorSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException("Session not found: " + sessionId);
        }
        return session;
    }

    public void closeSession(long sessionId) {
        if (sessions.remove(sessionId) == null) {
            throw new SessionNotFoundException("Session not found: " + sessionId);
        }
        logger.info("Closed session {}", sessionId);
    }

    public SessionView view(long sessionId) {
        return read(sessionId, SessionView::new);
    }

    /**
     * Deep copy of the rows, header row included, for the save boundary.
     */
    public List<List<String>> exportRows(long sessionId) {
        return read(sessionId, session -> session.getGrid().snapshot());
    }

    // ----------------------------------------------------------------
    // Selection and navigation
    // ----------------------------------------------------------------

    /**
     * Replaces the selection. An edit in progress is committed first.
     * Range corners are clamped into the grid; a row or column that does
     * not exist leaves the selection unchanged.
     */
    public void select(long sessionId, Selection selection) {
        write(sessionId, session -> {
            commitPendingEdit(session);
            Selection fitted = fitToGrid(session.getGrid(), selection);
            if (fitted != null) {
                session.setSelection(fitted);
            }
        });
    }

    /**
     * Selects every cell; ignored while editing or when the grid has no cells.
     */
    public void selectAll(long sessionId) {
        write(sessionId, session -> {
            Grid grid = session.getGrid();
            if (session.getEditSession().isEditing() || grid.isEmpty() || grid.columnCount() == 0) {
                return;
            }
            session.setSelection(Selection.range(0, 0, grid.rowCount() - 1, grid.columnCount() - 1));
        });
    }

    /**
     * Arrow-key navigation. Moves the range end by (rowDelta, colDelta),
     * clamped to the grid; with {@code extend} the range start stays put,
     * otherwise the result is a single cell. Disabled while editing.
     */
    public void move(long sessionId, int rowDelta, int colDelta, boolean extend) {
        write(sessionId, session -> {
            if (session.getEditSession().isEditing()) {
                return;
            }
            CellPosition anchor = new CellPosition(0, 0);
            CellPosition current = anchor;
            if (session.getSelection() instanceof Selection.CellRange range) {
                anchor = range.start();
                current = range.end();
            }
            moveTo(session, anchor, current.offset(rowDelta, colDelta), extend);
        });
    }

    // ----------------------------------------------------------------
    // Edit session
    // ----------------------------------------------------------------

    /**
     * Starts editing (row, col) seeded with its current text. Any edit on
     * another cell is committed first; the selection is cleared.
     */
    public void beginEdit(long sessionId, int row, int col) {
        write(sessionId, session -> {
            Grid grid = session.getGrid();
            CellPosition cell = new CellPosition(row, col);
            if (!grid.hasCell(row, col) || session.getEditSession().isEditing(cell)) {
                return;
            }
            commitPendingEdit(session);
            session.getEditSession().begin(cell, grid.getCell(row, col));
            session.setSelection(Selection.none());
            logger.debug("Session {}: editing {}", sessionId, cell);
        });
    }

    /**
     * Printable text typed by the user. While editing it is appended to the
     * buffer. Otherwise, with exactly one existing cell selected, it starts
     * an edit of that cell whose buffer is the typed text.
     */
    public void typeText(long sessionId, String text) {
        write(sessionId, session -> {
            if (text == null || text.isEmpty()) {
                return;
            }
            EditSession edit = session.getEditSession();
            if (edit.isEditing()) {
                edit.setBuffer(edit.getBuffer() + text);
                return;
            }
            if (session.getSelection() instanceof Selection.CellRange range && range.isSingleCell()) {
                CellPosition cell = range.start();
                if (session.getGrid().hasCell(cell.row(), cell.col())) {
                    edit.begin(cell, text);
                    session.setSelection(Selection.none());
                }
            }
        });
    }

    public void updateEditBuffer(long sessionId, String text) {
        write(sessionId, session -> session.getEditSession().setBuffer(text));
    }

    /**
     * Writes the edit buffer into its cell (focus lost / clicked away).
     */
    public void commitEdit(long sessionId) {
        write(sessionId, this::commitPendingEdit);
    }

    /**
     * Enter: commits the edit and selects the cell one row below.
     */
    public void confirmEdit(long sessionId) {
        write(sessionId, session -> {
            CellPosition cell = session.getEditSession().getEditingCell();
            if (cell == null) {
                return;
            }
            commitPendingEdit(session);
            moveTo(session, cell, cell.offset(1, 0), false);
        });
    }

    /**
     * Escape: drops the edit buffer without writing and clears the selection.
     */
    public void cancelEdit(long sessionId) {
        write(sessionId, session -> {
            session.getEditSession().cancel();
            session.setSelection(Selection.none());
        });
    }

    // ----------------------------------------------------------------
    // Clearing and clipboard
    // ----------------------------------------------------------------

    /**
     * Delete key: empties every selected cell. Ignored while editing.
     */
    public void clearSelectedCells(long sessionId) {
        write(sessionId, session -> {
            if (session.getEditSession().isEditing() || session.getSelection() instanceof Selection.None) {
                return;
            }
            session.saveUndoState();
            session.getSelection().clear(session.getGrid());
            session.clearSortIndicator();
        });
    }

    public void clearCell(long sessionId, int row, int col) {
        write(sessionId, session -> {
            if (!session.getGrid().hasCell(row, col)) {
                return;
            }
            session.saveUndoState();
            session.getGrid().setCell(row, col, "");
            session.clearSortIndicator();
        });
    }

    /**
     * Returns the selection as clipboard text and publishes it to the
     * clipboard when there is something to copy.
     */
    public String copy(long sessionId) {
        String text = read(sessionId, session -> clipboardCodec.extractText(session.getGrid(), session.getSelection()));
        publish(text);
        return text;
    }

    /**
     * Copy, then clear the selected cells. Nothing happens when the
     * selection yields no text.
     */
    public String cut(long sessionId) {
        String text = compute(sessionId, session -> {
            if (session.getEditSession().isEditing()) {
                return "";
            }
            String extracted = clipboardCodec.extractText(session.getGrid(), session.getSelection());
            if (extracted.isEmpty()) {
                return extracted;
            }
            session.saveUndoState();
            session.getSelection().clear(session.getGrid());
            session.clearSortIndicator();
            return extracted;
        });
        publish(text);
        return text;
    }

    /**
     * Pastes tab/newline text at the selection's top-left cell, growing the
     * grid as needed. Ignored while editing.
     */
    public void paste(long sessionId, String text) {
        write(sessionId, session -> {
            if (text == null || text.isEmpty() || session.getEditSession().isEditing()) {
                return;
            }
            session.saveUndoState();
            CellPosition anchor = session.getSelection().pasteAnchor();
            clipboardCodec.pasteText(session.getGrid(), text, anchor);
            session.clearSortIndicator();
            logger.debug("Session {}: pasted {} chars at {}", sessionId, text.length(), anchor);
        });
    }

    /**
     * Pastes whatever the clipboard transport currently holds.
     */
    public void pasteFromClipboard(long sessionId) {
        String text;
        try {
            text = clipboardTransport.getText();
        } catch (ClipboardUnavailableException e) {
            logger.debug("Clipboard unavailable, nothing pasted: {}", e.getMessage());
            return;
        }
        paste(sessionId, text);
    }

    // ----------------------------------------------------------------
    // Undo / redo
    // ----------------------------------------------------------------

    public void undo(long sessionId) {
        write(sessionId, session -> session.getHistory().undo(session.getGrid().snapshot())
                .ifPresent(previous -> restore(session, previous)));
    }

    public void redo(long sessionId) {
        write(sessionId, session -> session.getHistory().redo(session.getGrid().snapshot())
                .ifPresent(next -> restore(session, next)));
    }

    // ----------------------------------------------------------------
    // Structural edits
    // ----------------------------------------------------------------

    public void addRow(long sessionId) {
        write(sessionId, session -> {
            session.saveUndoState();
            session.getGrid().addRow();
            session.clearSortIndicator();
        });
    }

    public void addColumn(long sessionId) {
        write(sessionId, session -> {
            session.saveUndoState();
            session.getGrid().addColumn();
            session.clearSortIndicator();
        });
    }

    public void insertRowAt(long sessionId, int row) {
        write(sessionId, session -> {
            Grid grid = session.getGrid();
            if (row < 0 || row > grid.rowCount()) {
                return;
            }
            session.saveUndoState();
            grid.insertRowAt(row);
            session.getEditSession().onRowInserted(row);
            session.clearSortIndicator();
        });
    }

    public void insertColumnAt(long sessionId, int col) {
        write(sessionId, session -> {
            Grid grid = session.getGrid();
            if (col < 0 || col > grid.columnCount()) {
                return;
            }
            session.saveUndoState();
            grid.insertColumnAt(col);
            session.getEditSession().onColumnInserted(col);
            session.clearSortIndicator();
        });
    }

    public void deleteRow(long sessionId, int row) {
        write(sessionId, session -> {
            Grid grid = session.getGrid();
            if (!grid.hasRow(row)) {
                return;
            }
            session.saveUndoState();
            grid.deleteRow(row);
            session.getEditSession().onRowDeleted(row);
            session.clearSortIndicator();
        });
    }

    public void deleteColumn(long sessionId, int col) {
        write(sessionId, session -> {
            Grid grid = session.getGrid();
            if (col < 0 || col >= grid.columnCount()) {
                return;
            }
            session.saveUndoState();
            grid.deleteColumn(col);
            session.getEditSession().onColumnDeleted(col);
            session.clearSortIndicator();
        });
    }

    public void setColumnWidth(long sessionId, int col, double width) {
        write(sessionId, session -> session.getGrid().getColumnWidths().set(col, width));
    }

    public double columnWidth(long sessionId, int col) {
        return read(sessionId, session -> session.getGrid().getColumnWidths().get(col));
    }

    // ----------------------------------------------------------------
    // Search and sort
    // ----------------------------------------------------------------

    /**
     * Runs a new search and resets the result cursor to the first match.
     */
    public List<CellPosition> search(long sessionId, String query, boolean caseSensitive) {
        return compute(sessionId, session -> {
            SearchResults results = searchIndex.search(session.getGrid(), query, caseSensitive);
            session.setSearchResults(results);
            logger.debug("Session {}: search '{}' found {} match(es)", sessionId, query, results.getMatches().size());
            return results.getMatches();
        });
    }

    public Optional<CellPosition> nextResult(long sessionId) {
        return compute(sessionId, session -> showResult(session, session.getSearchResults().next()));
    }

    public Optional<CellPosition> prevResult(long sessionId) {
        return compute(sessionId, session -> showResult(session, session.getSearchResults().previous()));
    }

    /**
     * Stable sort of the rows by one column (undoable). Row 0 stays on top
     * when the session has a frozen header.
     */
    public void sortByColumn(long sessionId, int col, boolean ascending) {
        write(sessionId, session -> {
            if (session.getGrid().isEmpty() || col < 0) {
                return;
            }
            commitPendingEdit(session);
            session.saveUndoState();
            columnSorter.sortByColumn(session.getGrid(), col, ascending, session.isFrozenHeader());
            session.setSortIndicator(new SortIndicator(col, ascending));
            logger.debug("Session {}: sorted by column {} ({})", sessionId, col, ascending ? "asc" : "desc");
        });
    }

    public void setFrozenHeader(long sessionId, boolean frozen) {
        write(sessionId, session -> session.setFrozenHeader(frozen));
    }

    // ----------------------------------------------------------------
    // Document boundary
    // ----------------------------------------------------------------

    /**
     * Replaces the grid with the given rows (header row included as row 0).
     */
    public void loadRows(long sessionId, List<List<String>> rows, String name) {
        write(sessionId, session -> replaceDocument(session, rows, name));
    }

    /**
     * Parses CSV bytes and replaces the grid with them. On a parse failure
     * the current grid is left exactly as it was.
     */
    public void loadDocument(long sessionId, byte[] bytes, String name) {
        getSession(sessionId);
        List<List<String>> rows;
        try {
            rows = documentCodec.decode(bytes, name);
        } catch (MalformedDocumentException e) {
            logger.warn("Session {}: rejected document '{}': {}", sessionId, name, e.getMessage());
            throw e;
        }
        loadRows(sessionId, rows, name);
        logger.info("Session {}: loaded '{}' ({} rows)", sessionId, name, rows.size());
    }

    /**
     * Deposits bytes read asynchronously; picked up by {@link #pollPendingDocument(long)}.
     */
    public void offerDocument(long sessionId, byte[] bytes, String name) {
        getSession(sessionId).getPendingDocument().offer(bytes, name);
    }

    /**
     * Consumes the pending document, if any, and loads it.
     * Returns true when a document was loaded.
     */
    public boolean pollPendingDocument(long sessionId) {
        Optional<PendingDocumentSlot.PendingDocument> pending = getSession(sessionId).getPendingDocument().poll();
        if (pending.isEmpty()) {
            return false;
        }
        loadDocument(sessionId, pending.get().bytes(), pending.get().name());
        return true;
    }

    /**
     * Encodes the grid as CSV and marks the session clean. On failure the
     * dirty flag is left set so the save can be retried.
     */
    public byte[] saveDocument(long sessionId) {
        return compute(sessionId, session -> {
            byte[] bytes;
            try {
                bytes = documentCodec.encode(session.getGrid().snapshot());
            } catch (DocumentSaveException e) {
                logger.warn("Session {}: save failed: {}", sessionId, e.getMessage());
                throw e;
            }
            session.markClean();
            logger.info("Session {}: saved {} bytes", sessionId, bytes.length);
            return bytes;
        });
    }

    /**
     * Starts over with a blank grid of the default extents.
     */
    public void newDocument(long sessionId) {
        write(sessionId, session -> replaceDocument(session,
                Grid.blankRows(properties.getDefaultRows(), properties.getDefaultColumns()), null));
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    private void commitPendingEdit(EditorSession session) {
        if (!session.getEditSession().isEditing()) {
            return;
        }
        CellPosition written = session.getEditSession().commit(session.getGrid());
        if (written != null) {
            session.markDirty();
            session.clearSortIndicator();
            logger.debug("Session {}: committed edit at {}", session.getId(), written);
        }
    }

    private void moveTo(EditorSession session, CellPosition anchor, CellPosition target, boolean extend) {
        Grid grid = session.getGrid();
        if (grid.isEmpty() || grid.columnCount() == 0) {
            return;
        }
        CellPosition end = clamp(target, grid.rowCount() - 1, grid.columnCount() - 1);
        session.setSelection(new Selection.CellRange(extend ? anchor : end, end));
    }

    // Null when the selection cannot be placed on the grid
    private Selection fitToGrid(Grid grid, Selection selection) {
        if (selection == null || selection instanceof Selection.None) {
            return Selection.none();
        }
        if (grid.isEmpty() || grid.columnCount() == 0) {
            return null;
        }
        int lastRow = grid.rowCount() - 1;
        int lastCol = grid.columnCount() - 1;
        if (selection instanceof Selection.CellRange range) {
            return new Selection.CellRange(clamp(range.start(), lastRow, lastCol), clamp(range.end(), lastRow, lastCol));
        }
        if (selection instanceof Selection.Column column) {
            return column.index() >= 0 && column.index() <= lastCol ? column : null;
        }
        if (selection instanceof Selection.Row row) {
            return grid.hasRow(row.index()) ? row : null;
        }
        return null;
    }

    private static CellPosition clamp(CellPosition cell, int lastRow, int lastCol) {
        return new CellPosition(Math.max(0, Math.min(cell.row(), lastRow)), Math.max(0, Math.min(cell.col(), lastCol)));
    }

    private Optional<CellPosition> showResult(EditorSession session, Optional<CellPosition> result) {
        result.ifPresent(cell -> {
            commitPendingEdit(session);
            session.setSelection(Selection.cell(cell.row(), cell.col()));
        });
        return result;
    }

    private void restore(EditorSession session, List<List<String>> rows) {
        session.getGrid().replaceRows(rows);
        session.markDirty();
        session.clearSortIndicator();
    }

    private void replaceDocument(EditorSession session, List<List<String>> rows, String name) {
        session.getGrid().replaceRows(rows);
        session.getHistory().clear();
        session.getEditSession().cancel();
        session.setSelection(Selection.none());
        session.setSearchResults(SearchResults.empty());
        session.clearSortIndicator();
        session.setDocumentName(name);
        session.markClean();
    }

    // Clipboard failures never fail the copy/cut itself
    private void publish(String text) {
        if (text.isEmpty()) {
            return;
        }
        try {
            clipboardTransport.setText(text);
        } catch (ClipboardUnavailableException e) {
            logger.debug("Clipboard unavailable, text not published: {}", e.getMessage());
        }
    }

    private <T> T read(long sessionId, Function<EditorSession, T> operation) {
        EditorSession session = getSession(sessionId);
        session.getLock().readLock().lock();
        try {
            return operation.apply(session);
        } finally {
            session.getLock().readLock().unlock();
        }
    }

    private <T> T compute(long sessionId, Function<EditorSession, T> operation) {
        EditorSession session = getSession(sessionId);
        session.getLock().writeLock().lock();
        try {
            return operation.apply(session);
        } finally {
            session.getLock().writeLock().unlock();
        }
    }

    private void write(long sessionId, Consumer<EditorSession> operation) {
        compute(sessionId, session -> {
            operation.accept(session);
            return null;
        });
    }
}
