package com.abcft.sheetextract.core.table;

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Objects;

/**
 * A row of a table, see {@link TableColumn}.
 */
public final class TableRow {

    private final int index;
    private final String label;
    private final boolean header;
    private final ImmutableMap<String, Object> cells;
    private final int cellCount;

    public TableRow(int index, String label, boolean header, Map<String, Object> cells) {
        this.index = index;
        this.label = label;
        this.header = header;
        this.cells = ImmutableMap.copyOf(cells);
        this.cellCount = cells.size();
    }

    public TableRow(int index, String label, boolean header, int cellCount) {
        this.index = index;
        this.label = label;
        this.header = header;
        this.cells = ImmutableMap.of();
        this.cellCount = cellCount;
    }

    public int getIndex() {
        return index;
    }

    public String getLabel() {
        return label;
    }

    public boolean isHeader() {
        return header;
    }

    public Map<String, Object> getCells() {
        return cells;
    }

    public int getCellCount() {
        return cellCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TableRow that = (TableRow) o;
        return index == that.index && header == that.header && cellCount == that.cellCount
                && label.equals(that.label) && cells.equals(that.cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, label, header, cells, cellCount);
    }

    @Override
    public String toString() {
        return index + ":" + label + (header ? " (header)" : "");
    }

}
