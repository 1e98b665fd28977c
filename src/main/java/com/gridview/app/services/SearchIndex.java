package com.gridview.app.services;

import com.gridview.app.models.CellPosition;
import com.gridview.app.models.Grid;
import com.gridview.app.models.SearchResults;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Linear substring search over the grid in row-major order.
 */
@Service
public class SearchIndex {

    /**
     * Every cell containing {@code query}, top-to-bottom then left-to-right.
     * An empty query matches nothing. Without case sensitivity both sides
     * are lower-cased before comparing.
     */
    public SearchResults search(Grid grid, String query, boolean caseSensitive) {
        if (query == null || query.isEmpty()) {
            return new SearchResults(query == null ? "" : query, caseSensitive, List.of());
        }
        String needle = caseSensitive ? query : query.toLowerCase(Locale.ROOT);
        List<CellPosition> matches = new ArrayList<>();
        for (int r = 0; r < grid.rowCount(); r++) {
            for (int c = 0; c < grid.rowLength(r); c++) {
                String cell = grid.getCell(r, c);
                String haystack = caseSensitive ? cell : cell.toLowerCase(Locale.ROOT);
                if (haystack.contains(needle)) {
                    matches.add(new CellPosition(r, c));
                }
            }
        }
        return new SearchResults(query, caseSensitive, matches);
    }
}
