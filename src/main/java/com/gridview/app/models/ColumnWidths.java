package com.gridview.app.models;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sparse column-index -> display width map. Columns without an explicit
 * entry use the default width. Keys are re-indexed on column insert/delete
 * so a width stays attached to the column it was set on.
 */
public class ColumnWidths {

    public static final double MIN_WIDTH = 30.0;

    private final double defaultWidth;
    private Map<Integer, Double> widths = new HashMap<>();

    public ColumnWidths(double defaultWidth) {
        this.defaultWidth = defaultWidth;
    }

    public double getDefaultWidth() {
        return defaultWidth;
    }

    public double get(int col) {
        return widths.getOrDefault(col, defaultWidth);
    }

    /**
     * Sets an explicit width, never narrower than {@link #MIN_WIDTH}.
     */
    public void set(int col, double width) {
        if (col < 0 || Double.isNaN(width)) {
            return;
        }
        widths.put(col, Math.max(width, MIN_WIDTH));
    }

    public boolean hasExplicitWidth(int col) {
        return widths.containsKey(col);
    }

    /**
     * Entries at or after the inserted column move one to the right.
     */
    public void shiftForInsert(int insertedCol) {
        Map<Integer, Double> shifted = new HashMap<>();
        for (Map.Entry<Integer, Double> e : widths.entrySet()) {
            int idx = e.getKey();
            shifted.put(idx >= insertedCol ? idx + 1 : idx, e.getValue());
        }
        widths = shifted;
    }

    /**
     * Drops the deleted column's entry and moves later entries one to the left.
     */
    public void shiftForDelete(int deletedCol) {
        widths.remove(deletedCol);
        Map<Integer, Double> shifted = new HashMap<>();
        for (Map.Entry<Integer, Double> e : widths.entrySet()) {
            int idx = e.getKey();
            shifted.put(idx > deletedCol ? idx - 1 : idx, e.getValue());
        }
        widths = shifted;
    }

    // Sorted copy for display / JSON
    public Map<Integer, Double> asMap() {
        return Collections.unmodifiableMap(new TreeMap<>(widths));
    }
}
