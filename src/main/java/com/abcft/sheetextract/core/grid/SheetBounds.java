package com.abcft.sheetextract.core.grid;

import com.abcft.sheetextract.core.MalformedGridException;

import java.util.List;
import java.util.Objects;

/**
 * 1-based inclusive bounds of a sheet.
 */
public final class SheetBounds {

    private final int minRow;
    private final int maxRow;
    private final int minCol;
    private final int maxCol;

    /**
     * Create bounds in the {@code [min_row, min_col, max_row, max_col]} order used by sheet dimensions.
     *
     * @throws MalformedGridException if min is greater than max on either axis.
     */
    public static SheetBounds of(int minRow, int minCol, int maxRow, int maxCol) {
        return new SheetBounds(minRow, maxRow, minCol, maxCol);
    }

    /**
     * Parse a {@code [min_row, min_col, max_row, max_col]} dimension list.
     */
    public static SheetBounds fromDimensions(List<? extends Number> dimensions) {
        if (dimensions == null || dimensions.size() < 4) {
            throw new MalformedGridException("Sheet dimensions need 4 values: " + dimensions);
        }
        return of(dimensions.get(0).intValue(), dimensions.get(1).intValue(),
                dimensions.get(2).intValue(), dimensions.get(3).intValue());
    }

    private SheetBounds(int minRow, int maxRow, int minCol, int maxCol) {
        if (minRow > maxRow || minCol > maxCol) {
            throw new MalformedGridException(String.format(
                    "Inconsistent sheet bounds: rows %d-%d, cols %d-%d", minRow, maxRow, minCol, maxCol));
        }
        this.minRow = minRow;
        this.maxRow = maxRow;
        this.minCol = minCol;
        this.maxCol = maxCol;
    }

    public int getMinRow() {
        return minRow;
    }

    public int getMaxRow() {
        return maxRow;
    }

    public int getMinCol() {
        return minCol;
    }

    public int getMaxCol() {
        return maxCol;
    }

    public int getRowCount() {
        return maxRow - minRow + 1;
    }

    public int getColCount() {
        return maxCol - minCol + 1;
    }

    public boolean contains(int row, int col) {
        return row >= minRow && row <= maxRow && col >= minCol && col <= maxCol;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SheetBounds that = (SheetBounds) o;
        return minRow == that.minRow && maxRow == that.maxRow && minCol == that.minCol && maxCol == that.maxCol;
    }

    @Override
    public int hashCode() {
        return Objects.hash(minRow, maxRow, minCol, maxCol);
    }

    @Override
    public String toString() {
        return String.format("[%d,%d]-[%d,%d]", minRow, minCol, maxRow, maxCol);
    }

}
