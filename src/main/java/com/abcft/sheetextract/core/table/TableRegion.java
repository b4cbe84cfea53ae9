package com.abcft.sheetextract.core.table;

import com.abcft.sheetextract.core.grid.SheetBounds;
import com.abcft.sheetextract.core.table.detectors.DetectionMethod;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.apache.poi.ss.util.CellRangeAddress;

import java.util.Objects;

/**
 * A rectangular candidate table of a sheet, 1-based and inclusive.
 */
public final class TableRegion {

    private final int startRow;
    private final int endRow;
    private final int startCol;
    private final int endCol;
    private final DetectionMethod detectionMethod;
    private final int frozenRows;
    private final int frozenCols;

    public TableRegion(int startRow, int endRow, int startCol, int endCol, DetectionMethod detectionMethod) {
        this(startRow, endRow, startCol, endCol, detectionMethod, 0, 0);
    }

    public TableRegion(int startRow, int endRow, int startCol, int endCol, DetectionMethod detectionMethod,
                       int frozenRows, int frozenCols) {
        this.startRow = startRow;
        this.endRow = endRow;
        this.startCol = startCol;
        this.endCol = endCol;
        this.detectionMethod = Objects.requireNonNull(detectionMethod, "detectionMethod");
        this.frozenRows = frozenRows;
        this.frozenCols = frozenCols;
    }

    public static TableRegion of(SheetBounds bounds, DetectionMethod detectionMethod) {
        return new TableRegion(bounds.getMinRow(), bounds.getMaxRow(),
                bounds.getMinCol(), bounds.getMaxCol(), detectionMethod);
    }

    public int getStartRow() {
        return startRow;
    }

    public int getEndRow() {
        return endRow;
    }

    public int getStartCol() {
        return startCol;
    }

    public int getEndCol() {
        return endCol;
    }

    public DetectionMethod getDetectionMethod() {
        return detectionMethod;
    }

    public String getDetectionMethodName() {
        return detectionMethod.getAlgorithmName();
    }

    public int getFrozenRows() {
        return frozenRows;
    }

    public int getFrozenCols() {
        return frozenCols;
    }

    public int getRowCount() {
        return Math.max(endRow - startRow + 1, 0);
    }

    public int getColCount() {
        return Math.max(endCol - startCol + 1, 0);
    }

    /**
     * Zero width or height regions are treated as no-op downstream.
     */
    public boolean isEmpty() {
        return startRow > endRow || startCol > endCol;
    }

    public boolean containsRow(int row) {
        return row >= startRow && row <= endRow;
    }

    public boolean containsCol(int col) {
        return col >= startCol && col <= endCol;
    }

    /**
     * Clip to the sheet bounds.
     *
     * @return the clipped region, might be empty.
     */
    public TableRegion clip(SheetBounds bounds) {
        return new TableRegion(
                Math.max(startRow, bounds.getMinRow()), Math.min(endRow, bounds.getMaxRow()),
                Math.max(startCol, bounds.getMinCol()), Math.min(endCol, bounds.getMaxCol()),
                detectionMethod, frozenRows, frozenCols);
    }

    public TableRegion withStartRow(int newStartRow) {
        return new TableRegion(newStartRow, endRow, startCol, endCol, detectionMethod, frozenRows, frozenCols);
    }

    /**
     * A1 style reference of this region, like {@code A1:C10}.
     */
    public String formatAsString() {
        if (isEmpty()) {
            return "";
        }
        return new CellRangeAddress(startRow - 1, endRow - 1, startCol - 1, endCol - 1).formatAsString();
    }

    public JsonObject toDocument() {
        JsonObject doc = new JsonObject();
        JsonArray area = new JsonArray();
        area.add(startRow);
        area.add(startCol);
        area.add(endRow);
        area.add(endCol);
        doc.add("area", area);
        doc.addProperty("ref", formatAsString());
        doc.addProperty("method", getDetectionMethodName());
        if (frozenRows > 0 || frozenCols > 0) {
            doc.addProperty("frozen_rows", frozenRows);
            doc.addProperty("frozen_cols", frozenCols);
        }
        return doc;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TableRegion that = (TableRegion) o;
        return startRow == that.startRow && endRow == that.endRow
                && startCol == that.startCol && endCol == that.endCol
                && frozenRows == that.frozenRows && frozenCols == that.frozenCols
                && detectionMethod == that.detectionMethod;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startRow, endRow, startCol, endCol, detectionMethod, frozenRows, frozenCols);
    }

    @Override
    public String toString() {
        return String.format("TableRegion{%s, rows %d-%d, cols %d-%d}",
                getDetectionMethodName(), startRow, endRow, startCol, endCol);
    }

}
