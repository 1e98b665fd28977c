package com.gridview.app.models;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents one open document and its transient editing state:
 * - A unique ID
 * - The grid, the current selection and the single edit session
 * - Undo/redo history, last search results and the sort marker
 * - Dirty flag, document name and frozen-header policy
 * - A pending-document mailbox for asynchronous loads
 * - A read/write lock so each operation runs to completion before the next
 */
public class EditorSession {

    // Generates unique IDs for newly created sessions
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final Grid grid;
    private final UndoHistory history;
    private final EditSession editSession = new EditSession();
    private final PendingDocumentSlot pendingDocument = new PendingDocumentSlot();

    private Selection selection = Selection.none();
    private SearchResults searchResults = SearchResults.empty();
    private SortIndicator sortIndicator;
    private boolean dirty;
    private boolean frozenHeader;
    private String documentName;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public EditorSession(Grid grid, UndoHistory history, boolean frozenHeader) {
        this.id = ID_GENERATOR.getAndIncrement();
        this.grid = grid;
        this.history = history;
        this.frozenHeader = frozenHeader;
    }

    public long getId() {
        return id;
    }

    public Grid getGrid() {
        return grid;
    }

    public UndoHistory getHistory() {
        return history;
    }

    public EditSession getEditSession() {
        return editSession;
    }

    public PendingDocumentSlot getPendingDocument() {
        return pendingDocument;
    }

    public Selection getSelection() {
        return selection;
    }

    public void setSelection(Selection selection) {
        this.selection = selection == null ? Selection.none() : selection;
    }

    public SearchResults getSearchResults() {
        return searchResults;
    }

    public void setSearchResults(SearchResults searchResults) {
        this.searchResults = searchResults;
    }

    /**
     * Column the grid was last sorted by, or null.
     */
    public SortIndicator getSortIndicator() {
        return sortIndicator;
    }

    public void setSortIndicator(SortIndicator sortIndicator) {
        this.sortIndicator = sortIndicator;
    }

    public void clearSortIndicator() {
        this.sortIndicator = null;
    }

    public boolean isDirty() {
        return dirty;
    }

    public void markDirty() {
        this.dirty = true;
    }

    public void markClean() {
        this.dirty = false;
    }

    public boolean isFrozenHeader() {
        return frozenHeader;
    }

    public void setFrozenHeader(boolean frozenHeader) {
        this.frozenHeader = frozenHeader;
    }

    public String getDocumentName() {
        return documentName;
    }

    public void setDocumentName(String documentName) {
        this.documentName = documentName;
    }

    /**
     * Snapshots the grid onto the undo side before a mutation.
     * Clears redo and marks the document dirty.
     */
    public void saveUndoState() {
        history.record(grid.snapshot());
        dirty = true;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
