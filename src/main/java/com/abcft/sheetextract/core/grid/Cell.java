package com.abcft.sheetextract.core.grid;

import com.abcft.sheetextract.core.util.NumberUtil;
import org.apache.poi.ss.util.CellReference;

import java.util.Objects;

/**
 * A populated cell of a sheet.
 *
 * <p>A cell with {@link #getRunLength()} greater than one stands for a run of consecutive columns
 * sharing the same value, starting at {@link #getCol()}. Runs are never expanded: presence checks
 * only see the starting column, counting multiplies by the run length.</p>
 */
public final class Cell {

    private final int row;
    private final int col;
    private final Object value;
    private final int runLength;

    public Cell(int row, int col, Object value) {
        this(row, col, value, 1);
    }

    public Cell(int row, int col, Object value, int runLength) {
        this.row = row;
        this.col = col;
        this.value = Objects.requireNonNull(value, "value");
        this.runLength = runLength;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    public Object getValue() {
        return value;
    }

    public int getRunLength() {
        return runLength;
    }

    public boolean isRun() {
        return runLength > 1;
    }

    /**
     * Last column covered by this cell, {@code col + runLength - 1} for a run.
     */
    public int getLastCol() {
        return col + Math.max(runLength, 1) - 1;
    }

    /**
     * Number of logical cells this entry stands for.
     */
    public int getWeight() {
        return Math.max(runLength, 0);
    }

    /**
     * 数值单元格，布尔值不算。
     */
    public boolean isNumeric() {
        return value instanceof Number;
    }

    /**
     * Numeric value or a string which reads as a number.
     */
    public boolean isNumberLike() {
        return isNumeric() || (value instanceof String && NumberUtil.isNumericString((String) value));
    }

    public boolean isText() {
        return value instanceof String;
    }

    public String getText() {
        return NumberUtil.formatValue(value);
    }

    public String getCoordinate() {
        return CellReference.convertNumToColString(col - 1) + row;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Cell cell = (Cell) o;
        return row == cell.row && col == cell.col && runLength == cell.runLength && value.equals(cell.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, col, value, runLength);
    }

    @Override
    public String toString() {
        return isRun()
                ? String.format("%s=%s x%d", getCoordinate(), value, runLength)
                : String.format("%s=%s", getCoordinate(), value);
    }

}
