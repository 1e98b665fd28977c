package com.gridview.app.services;

import com.gridview.app.models.CellPosition;
import com.gridview.app.models.Grid;
import com.gridview.app.models.Selection;
import com.gridview.app.models.SelectionBounds;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Converts between selections and spreadsheet clipboard text:
 * '\t' between fields, '\n' between records, no escaping.
 *
 * A cell that itself contains a tab or newline is copied as-is and will
 * split into extra cells/rows when pasted back.
 */
@Service
public class ClipboardCodec {

    private static final String FIELD_SEPARATOR = "\t";
    private static final String RECORD_SEPARATOR = "\n";

    /**
     * Serializes the selected cells. Empty string means "nothing to copy".
     * - CellRange: every row of the bound, every column of the bound;
     *   coordinates outside the grid come out as empty fields
     * - Column: one line per existing row
     * - Row: one tab-joined line (empty if the row doesn't exist)
     */
    public String extractText(Grid grid, Selection selection) {
        if (selection instanceof Selection.CellRange range) {
            SelectionBounds b = range.bounds();
            StringJoiner lines = new StringJoiner(RECORD_SEPARATOR);
            for (int r = b.minRow(); r <= b.maxRow(); r++) {
                StringJoiner fields = new StringJoiner(FIELD_SEPARATOR);
                for (int c = b.minCol(); c <= b.maxCol(); c++) {
                    fields.add(grid.getCell(r, c));
                }
                lines.add(fields.toString());
            }
            return lines.toString();
        }
        if (selection instanceof Selection.Column column) {
            StringJoiner lines = new StringJoiner(RECORD_SEPARATOR);
            for (int r = 0; r < grid.rowCount(); r++) {
                lines.add(grid.getCell(r, column.index()));
            }
            return lines.toString();
        }
        if (selection instanceof Selection.Row row) {
            StringJoiner fields = new StringJoiner(FIELD_SEPARATOR);
            for (int c = 0; c < grid.rowLength(row.index()); c++) {
                fields.add(grid.getCell(row.index(), c));
            }
            return fields.toString();
        }
        return "";
    }

    /**
     * Writes pasted text into the grid starting at {@code anchor}, growing
     * rows and columns as needed, then re-rectangularizes the grid.
     */
    public void pasteText(Grid grid, String text, CellPosition anchor) {
        List<String> lines = splitLines(text);
        for (int i = 0; i < lines.size(); i++) {
            String[] fields = lines.get(i).split(FIELD_SEPARATOR, -1);
            int row = anchor.row() + i;
            for (int j = 0; j < fields.length; j++) {
                int col = anchor.col() + j;
                if (row < 0 || col < 0) {
                    continue;
                }
                grid.ensureCell(row, col);
                grid.setCell(row, col, fields[j]);
            }
        }
        grid.normalize();
    }

    /**
     * Splits on '\n', dropping one trailing '\r' per line and the empty
     * remainder after a final newline.
     */
    static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return lines;
        }
        String[] parts = text.split(RECORD_SEPARATOR, -1);
        int count = text.endsWith(RECORD_SEPARATOR) ? parts.length - 1 : parts.length;
        for (int i = 0; i < count; i++) {
            String line = parts[i];
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            lines.add(line);
        }
        return lines;
    }
}
