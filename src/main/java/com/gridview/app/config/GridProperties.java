package com.gridview.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables under the "gridview" prefix, e.g. gridview.history-depth=50.
 * Field defaults apply when nothing is configured (and in plain unit tests).
 */
@ConfigurationProperties(prefix = "gridview")
public class GridProperties {

    // Extents of a new document
    private int defaultRows = 20;
    private int defaultColumns = 10;

    private double defaultColumnWidth = 120.0;

    // Undo snapshots kept per session
    private int historyDepth = 50;

    // Whether row 0 stays put when sorting, for new sessions
    private boolean frozenHeader = false;

    public int getDefaultRows() {
        return defaultRows;
    }
    public void setDefaultRows(int defaultRows) {
        this.defaultRows = defaultRows;
    }
    public int getDefaultColumns() {
        return defaultColumns;
    }
    public void setDefaultColumns(int defaultColumns) {
        this.defaultColumns = defaultColumns;
    }
    public double getDefaultColumnWidth() {
        return defaultColumnWidth;
    }
    public void setDefaultColumnWidth(double defaultColumnWidth) {
        this.defaultColumnWidth = defaultColumnWidth;
    }
    public int getHistoryDepth() {
        return historyDepth;
    }
    public void setHistoryDepth(int historyDepth) {
        this.historyDepth = historyDepth;
    }
    public boolean isFrozenHeader() {
        return frozenHeader;
    }
    public void setFrozenHeader(boolean frozenHeader) {
        this.frozenHeader = frozenHeader;
    }
}
