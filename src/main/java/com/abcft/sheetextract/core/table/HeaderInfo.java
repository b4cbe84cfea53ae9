package com.abcft.sheetextract.core.table;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.List;
import java.util.Objects;

/**
 * Header rows/columns of a table region and the first data row/column.
 */
public final class HeaderInfo {

    private final ImmutableList<Integer> headerRows;
    private final ImmutableList<Integer> headerColumns;
    private final int dataStartRow;
    private final int dataStartCol;

    public HeaderInfo(List<Integer> headerRows, List<Integer> headerColumns, int dataStartRow, int dataStartCol) {
        this.headerRows = ImmutableList.copyOf(headerRows);
        this.headerColumns = ImmutableList.copyOf(headerColumns);
        this.dataStartRow = dataStartRow;
        this.dataStartCol = dataStartCol;
    }

    public List<Integer> getHeaderRows() {
        return headerRows;
    }

    public List<Integer> getHeaderColumns() {
        return headerColumns;
    }

    public int getDataStartRow() {
        return dataStartRow;
    }

    public int getDataStartCol() {
        return dataStartCol;
    }

    public boolean isHeaderRow(int row) {
        return headerRows.contains(row);
    }

    public boolean isHeaderColumn(int col) {
        return headerColumns.contains(col);
    }

    JsonObject toDocument() {
        JsonObject doc = new JsonObject();
        JsonArray rows = new JsonArray();
        headerRows.forEach(rows::add);
        JsonArray cols = new JsonArray();
        headerColumns.forEach(cols::add);
        doc.add("rows", rows);
        doc.add("cols", cols);
        JsonArray dataStart = new JsonArray();
        dataStart.add(dataStartRow);
        dataStart.add(dataStartCol);
        doc.add("data_start", dataStart);
        return doc;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HeaderInfo that = (HeaderInfo) o;
        return dataStartRow == that.dataStartRow && dataStartCol == that.dataStartCol
                && headerRows.equals(that.headerRows) && headerColumns.equals(that.headerColumns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(headerRows, headerColumns, dataStartRow, dataStartCol);
    }

    @Override
    public String toString() {
        return "HeaderInfo{rows=" + headerRows + ", cols=" + headerColumns
                + ", dataStart=[" + dataStartRow + "," + dataStartCol + "]}";
    }

}
