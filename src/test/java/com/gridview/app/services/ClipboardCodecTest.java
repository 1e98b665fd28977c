package com.gridview.app.services;

import com.gridview.app.models.CellPosition;
import com.gridview.app.models.Grid;
import com.gridview.app.models.Selection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Clipboard text in and out of the grid.
 */
class ClipboardCodecTest {

    private ClipboardCodec codec;

    @BeforeEach
    void setUp() {
        codec = new ClipboardCodec();
    }

    private static Grid gridOf(List<List<String>> rows) {
        Grid grid = new Grid(120.0);
        grid.replaceRows(rows);
        return grid;
    }

    @Test
    void testExtractRange() {
        Grid grid = gridOf(List.of(List.of("a", "b"), List.of("c", "d")));
        assertEquals("a\tb\nc\td", codec.extractText(grid, Selection.range(0, 0, 1, 1)));
        assertEquals("a\tb\nc\td", codec.extractText(grid, Selection.range(1, 1, 0, 0)));
    }

    /**
     * Coordinates outside the grid still produce (empty) fields,
     * keeping the copied block rectangular.
     */
    @Test
    void testExtractRangePastGridEdgeKeepsShape() {
        Grid grid = gridOf(List.of(List.of("a", "b"), List.of("c", "d")));
        assertEquals("b\t\nd\t\n\t", codec.extractText(grid, Selection.range(0, 1, 2, 2)));
    }

    @Test
    void testExtractColumnRowAndNone() {
        Grid grid = gridOf(List.of(List.of("a", "b"), List.of("c", "d"), List.of("e", "f")));
        assertEquals("b\nd\nf", codec.extractText(grid, Selection.column(1)));
        assertEquals("\n\n", codec.extractText(grid, Selection.column(5)));
        assertEquals("c\td", codec.extractText(grid, Selection.row(1)));
        assertEquals("", codec.extractText(grid, Selection.row(7)));
        assertEquals("", codec.extractText(grid, Selection.none()));
    }

    @Test
    void testPasteIntoEmptyGrid() {
        Grid grid = new Grid(120.0);
        codec.pasteText(grid, "x\ty\nz\tw", new CellPosition(0, 0));
        assertEquals(List.of(List.of("x", "y"), List.of("z", "w")), grid.snapshot());
    }

    /**
     * Early short lines are padded once a later line widens the grid.
     */
    @Test
    void testPasteGrowsAndNormalizes() {
        Grid grid = gridOf(List.of(List.of("a", "b")));
        codec.pasteText(grid, "1\n2\t3\t4", new CellPosition(1, 1));

        assertEquals(List.of(
                List.of("a", "b", "", ""),
                List.of("", "1", "", ""),
                List.of("", "2", "3", "4")), grid.snapshot());
    }

    @Test
    void testPasteIgnoresTrailingNewlineAndCarriageReturns() {
        Grid grid = gridOf(List.of(List.of("", ""), List.of("", "")));
        codec.pasteText(grid, "p\tq\r\nr\ts\r\n", new CellPosition(0, 0));
        assertEquals(List.of(List.of("p", "q"), List.of("r", "s")), grid.snapshot());
    }

    @Test
    void testPasteKeepsEmptyFields() {
        Grid grid = gridOf(List.of(List.of("a", "b", "c")));
        codec.pasteText(grid, "\tX\t", new CellPosition(0, 0));
        assertEquals(List.of(List.of("", "X", "")), grid.snapshot());
    }

    /**
     * Copy a block, wipe it, paste the text back at the block's top-left:
     * the same contents return exactly (whitespace included).
     */
    @Test
    void testCopyPasteRoundTrip() {
        List<List<String>> rows = List.of(
                List.of("1", " two ", "3"),
                List.of("four", "", "six"),
                List.of("7", "8", "nine "));
        Grid grid = gridOf(rows);
        Selection selection = Selection.range(2, 2, 0, 1);

        String text = codec.extractText(grid, selection);
        selection.clear(grid);
        codec.pasteText(grid, text, selection.pasteAnchor());

        assertEquals(rows, grid.snapshot());
    }

    @Test
    void testSplitLines() {
        assertEquals(List.of(), ClipboardCodec.splitLines(""));
        assertEquals(List.of(""), ClipboardCodec.splitLines("\n"));
        assertEquals(List.of("a", "", "b"), ClipboardCodec.splitLines("a\n\nb"));
    }
}
