package com.abcft.sheetextract.core.table;

import com.abcft.sheetextract.core.grid.Cell;
import com.abcft.sheetextract.core.util.NumberUtil;
import com.google.gson.JsonObject;

import java.util.Objects;

/**
 * One level of a column or row header hierarchy: the header cell and its 1-based depth.
 */
public final class HeaderLevel {

    private final int level;
    private final Object value;
    private final int row;
    private final int column;
    private final String coordinate;

    HeaderLevel(int level, Cell cell) {
        this.level = level;
        this.value = cell.getValue();
        this.row = cell.getRow();
        this.column = cell.getCol();
        this.coordinate = cell.getCoordinate();
    }

    public int getLevel() {
        return level;
    }

    public Object getValue() {
        return value;
    }

    public String getText() {
        return NumberUtil.formatValue(value);
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    public String getCoordinate() {
        return coordinate;
    }

    JsonObject toDocument() {
        JsonObject doc = new JsonObject();
        doc.addProperty("level", level);
        doc.addProperty("value", getText());
        doc.addProperty("coordinate", coordinate);
        return doc;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HeaderLevel that = (HeaderLevel) o;
        return level == that.level && row == that.row && column == that.column
                && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, value, row, column);
    }

    @Override
    public String toString() {
        return level + ":" + coordinate + "=" + value;
    }

}
