package com.gridview.app.services;

import com.gridview.app.models.Grid;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Stable row sort keyed on one column's text.
 *
 * Two cells compare numerically when both parse as decimal numbers,
 * otherwise by ordinal string order. The pairwise rule is not transitive
 * over mixed columns ("9" < "10" < "1a" < "9"), so rows are ordered with a
 * run-detecting merge sort that never inspects the comparator for
 * consistency and leaves already ordered rows where they are.
 */
@Service
public class ColumnSorter {

    // Plain decimal / scientific notation, optional sign, plus inf/infinity/nan
    private static final Pattern NUMBER = Pattern.compile(
            "[+-]?((\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?|(?i:inf|infinity|nan))");

    /**
     * Reorders the grid's rows by {@code col}. With {@code frozenHeader}
     * row 0 keeps its place and only the rows below it move.
     */
    public void sortByColumn(Grid grid, int col, boolean ascending, boolean frozenHeader) {
        if (grid.isEmpty()) {
            return;
        }
        List<List<String>> rows = grid.snapshot();
        int first = frozenHeader ? 1 : 0;
        if (rows.size() - first < 2) {
            return;
        }

        Comparator<List<String>> comparator = (a, b) -> compareCells(cellAt(a, col), cellAt(b, col));
        if (!ascending) {
            comparator = comparator.reversed();
        }

        List<List<String>> sorted = new ArrayList<>(rows.subList(0, first));
        sorted.addAll(mergeSort(new ArrayList<>(rows.subList(first, rows.size())), comparator));
        grid.replaceRows(sorted);
    }

    /**
     * Numeric comparison when both sides parse, ordinal text comparison otherwise.
     */
    public static int compareCells(String a, String b) {
        Double x = parseNumber(a);
        Double y = parseNumber(b);
        if (x != null && y != null) {
            return Double.compare(x, y);
        }
        return a.compareTo(b);
    }

    /**
     * The cell's value as a double, or null when it is not a number.
     * Surrounding whitespace and Java's type suffixes ("1d", "2f") are rejected.
     */
    static Double parseNumber(String text) {
        if (text == null || !NUMBER.matcher(text).matches()) {
            return null;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String unsigned = lower.startsWith("-") || lower.startsWith("+") ? lower.substring(1) : lower;
        boolean negative = lower.startsWith("-");
        switch (unsigned) {
            case "inf":
            case "infinity":
                return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            case "nan":
                return Double.NaN;
            default:
                return Double.parseDouble(text);
        }
    }

    private static String cellAt(List<String> row, int col) {
        return col >= 0 && col < row.size() ? row.get(col) : "";
    }

    /**
     * Stable natural merge sort. The input is split into its existing
     * non-descending runs, which are merged pairwise until one remains.
     * Input whose neighbours are already in order is one run and comes
     * back unchanged, and every merge leaves its neighbours in order, so
     * a second pass is a no-op even when the comparator is not transitive.
     */
    private static <T> List<T> mergeSort(List<T> items, Comparator<? super T> comparator) {
        List<List<T>> runs = new ArrayList<>();
        List<T> run = new ArrayList<>();
        for (T item : items) {
            if (!run.isEmpty() && comparator.compare(item, run.get(run.size() - 1)) < 0) {
                runs.add(run);
                run = new ArrayList<>();
            }
            run.add(item);
        }
        if (!run.isEmpty()) {
            runs.add(run);
        }
        if (runs.isEmpty()) {
            return items;
        }

        while (runs.size() > 1) {
            List<List<T>> next = new ArrayList<>((runs.size() + 1) / 2);
            for (int k = 0; k + 1 < runs.size(); k += 2) {
                next.add(merge(runs.get(k), runs.get(k + 1), comparator));
            }
            if (runs.size() % 2 == 1) {
                next.add(runs.get(runs.size() - 1));
            }
            runs = next;
        }
        return runs.get(0);
    }

    // On ties the left element wins
    private static <T> List<T> merge(List<T> left, List<T> right, Comparator<? super T> comparator) {
        List<T> merged = new ArrayList<>(left.size() + right.size());
        int i = 0;
        int j = 0;
        while (i < left.size() && j < right.size()) {
            if (comparator.compare(right.get(j), left.get(i)) < 0) {
                merged.add(right.get(j++));
            } else {
                merged.add(left.get(i++));
            }
        }
        while (i < left.size()) {
            merged.add(left.get(i++));
        }
        while (j < right.size()) {
            merged.add(right.get(j++));
        }
        return merged;
    }
}
