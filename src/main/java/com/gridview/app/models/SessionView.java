package com.gridview.app.models;

import java.util.List;
import java.util.Map;

/**
 * Read-only picture of a session handed to the rendering side.
 * Built under the session's read lock; holds copies, never live state.
 */
public class SessionView {
    private final long id;
    private final List<List<String>> rows;
    private final int rowCount;
    private final int columnCount;
    private final SelectionDto selection;
    private final CellPosition editingCell;
    private final String editBuffer;
    private final boolean dirty;
    private final String documentName;
    private final boolean frozenHeader;
    private final SortIndicator sortIndicator;
    private final String searchQuery;
    private final boolean searchCaseSensitive;
    private final List<CellPosition> searchMatches;
    private final int searchIndex;
    private final Map<Integer, Double> columnWidths;
    private final double defaultColumnWidth;
    private final int undoDepth;
    private final int redoDepth;

    public SessionView(EditorSession session) {
        Grid grid = session.getGrid();
        this.id = session.getId();
        this.rows = grid.snapshot();
        this.rowCount = grid.rowCount();
        this.columnCount = grid.columnCount();
        this.selection = SelectionDto.from(session.getSelection());
        this.editingCell = session.getEditSession().getEditingCell();
        this.editBuffer = session.getEditSession().isEditing() ? session.getEditSession().getBuffer() : null;
        this.dirty = session.isDirty();
        this.documentName = session.getDocumentName();
        this.frozenHeader = session.isFrozenHeader();
        this.sortIndicator = session.getSortIndicator();
        this.searchQuery = session.getSearchResults().getQuery();
        this.searchCaseSensitive = session.getSearchResults().isCaseSensitive();
        this.searchMatches = session.getSearchResults().getMatches();
        this.searchIndex = session.getSearchResults().getCurrentIndex();
        this.columnWidths = grid.getColumnWidths().asMap();
        this.defaultColumnWidth = grid.getColumnWidths().getDefaultWidth();
        this.undoDepth = session.getHistory().undoDepth();
        this.redoDepth = session.getHistory().redoDepth();
    }

    public long getId() {
        return id;
    }

    public List<List<String>> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public SelectionDto getSelection() {
        return selection;
    }

    public CellPosition getEditingCell() {
        return editingCell;
    }

    public String getEditBuffer() {
        return editBuffer;
    }

    public boolean isDirty() {
        return dirty;
    }

    public String getDocumentName() {
        return documentName;
    }

    public boolean isFrozenHeader() {
        return frozenHeader;
    }

    public SortIndicator getSortIndicator() {
        return sortIndicator;
    }

    public String getSearchQuery() {
        return searchQuery;
    }

    public boolean isSearchCaseSensitive() {
        return searchCaseSensitive;
    }

    public List<CellPosition> getSearchMatches() {
        return searchMatches;
    }

    public int getSearchIndex() {
        return searchIndex;
    }

    public Map<Integer, Double> getColumnWidths() {
        return columnWidths;
    }

    public double getDefaultColumnWidth() {
        return defaultColumnWidth;
    }

    public int getUndoDepth() {
        return undoDepth;
    }

    public int getRedoDepth() {
        return redoDepth;
    }
}
