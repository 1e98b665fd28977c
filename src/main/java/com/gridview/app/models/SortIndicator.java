package com.gridview.app.models;

/**
 * Display marker for the column the grid was last sorted by.
 * Advisory only: it is not derived from the data and is dropped as soon
 * as the data changes in a way that may break the order.
 */
public record SortIndicator(int column, boolean ascending) {
}
