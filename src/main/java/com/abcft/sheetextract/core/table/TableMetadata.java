package com.abcft.sheetextract.core.table;

import com.google.gson.JsonObject;

import java.util.Objects;

/**
 * Detection method and cell counts of a table.
 */
public final class TableMetadata {

    private final String detectionMethod;
    private final int cellCount;
    private final int numericCellCount;

    public TableMetadata(String detectionMethod, int cellCount, int numericCellCount) {
        this.detectionMethod = detectionMethod;
        this.cellCount = cellCount;
        this.numericCellCount = numericCellCount;
    }

    public String getDetectionMethod() {
        return detectionMethod;
    }

    public int getCellCount() {
        return cellCount;
    }

    public int getNumericCellCount() {
        return numericCellCount;
    }

    JsonObject toDocument() {
        JsonObject doc = new JsonObject();
        doc.addProperty("method", detectionMethod);
        doc.addProperty("cells", cellCount);
        doc.addProperty("numeric_cells", numericCellCount);
        return doc;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TableMetadata that = (TableMetadata) o;
        return cellCount == that.cellCount && numericCellCount == that.numericCellCount
                && Objects.equals(detectionMethod, that.detectionMethod);
    }

    @Override
    public int hashCode() {
        return Objects.hash(detectionMethod, cellCount, numericCellCount);
    }

    @Override
    public String toString() {
        return "TableMetadata{" + detectionMethod + ", cells=" + cellCount + ", numeric=" + numericCellCount + '}';
    }

}
