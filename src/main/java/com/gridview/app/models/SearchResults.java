package com.gridview.app.models;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered matches of the last search plus a cyclic cursor into them.
 */
public class SearchResults {

    private final String query;
    private final boolean caseSensitive;
    private final List<CellPosition> matches;
    private int current;

    public SearchResults(String query, boolean caseSensitive, List<CellPosition> matches) {
        this.query = query;
        this.caseSensitive = caseSensitive;
        this.matches = List.copyOf(matches);
        this.current = 0;
    }

    public static SearchResults empty() {
        return new SearchResults("", false, Collections.emptyList());
    }

    public String getQuery() {
        return query;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    public List<CellPosition> getMatches() {
        return matches;
    }

    public int getCurrentIndex() {
        return current;
    }

    public boolean isEmpty() {
        return matches.isEmpty();
    }

    public Optional<CellPosition> next() {
        return rotate(1);
    }

    public Optional<CellPosition> previous() {
        return rotate(-1);
    }

    private Optional<CellPosition> rotate(int step) {
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        current = Math.floorMod(current + step, matches.size());
        return Optional.of(matches.get(current));
    }
}
