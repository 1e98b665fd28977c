package com.gridview.app.models;

import java.util.Locale;

/**
 * Flat JSON form of a {@link Selection}, for example:
 * { "type": "range", "startRow": 0, "startCol": 0, "endRow": 2, "endCol": 1 }
 * { "type": "column", "index": 3 }
 * { "type": "none" }
 */
public class SelectionDto {
    private String type;
    private Integer startRow;
    private Integer startCol;
    private Integer endRow;
    private Integer endCol;
    private Integer index;

    // Default constructor needed for JSON (de)serialization
    public SelectionDto() {
    }

    public static SelectionDto from(Selection selection) {
        SelectionDto dto = new SelectionDto();
        if (selection instanceof Selection.CellRange range) {
            dto.type = "range";
            dto.startRow = range.start().row();
            dto.startCol = range.start().col();
            dto.endRow = range.end().row();
            dto.endCol = range.end().col();
        } else if (selection instanceof Selection.Column column) {
            dto.type = "column";
            dto.index = column.index();
        } else if (selection instanceof Selection.Row row) {
            dto.type = "row";
            dto.index = row.index();
        } else {
            dto.type = "none";
        }
        return dto;
    }

    /**
     * Converts back to a Selection. Missing coordinates default to 0;
     * an unknown or missing type means no selection. A range with no end
     * is a single cell.
     */
    public Selection toSelection() {
        if (type == null) {
            return Selection.none();
        }
        switch (type.toLowerCase(Locale.ROOT)) {
            case "range":
            case "cell":
                int sr = orZero(startRow);
                int sc = orZero(startCol);
                return Selection.range(sr, sc,
                        endRow == null ? sr : endRow,
                        endCol == null ? sc : endCol);
            case "column":
                return Selection.column(orZero(index));
            case "row":
                return Selection.row(orZero(index));
            default:
                return Selection.none();
        }
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }

    public String getType() {
        return type;
    }
    public Integer getStartRow() {
        return startRow;
    }
    public Integer getStartCol() {
        return startCol;
    }
    public Integer getEndRow() {
        return endRow;
    }
    public Integer getEndCol() {
        return endCol;
    }
    public Integer getIndex() {
        return index;
    }
    public void setType(String type) {
        this.type = type;
    }
    public void setStartRow(Integer startRow) {
        this.startRow = startRow;
    }
    public void setStartCol(Integer startCol) {
        this.startCol = startCol;
    }
    public void setEndRow(Integer endRow) {
        this.endRow = endRow;
    }
    public void setEndCol(Integer endCol) {
        this.endCol = endCol;
    }
    public void setIndex(Integer index) {
        this.index = index;
    }
}
