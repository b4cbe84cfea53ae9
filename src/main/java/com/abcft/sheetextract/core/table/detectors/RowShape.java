package com.abcft.sheetextract.core.table.detectors;

import com.abcft.sheetextract.core.grid.Cell;
import com.abcft.sheetextract.core.grid.Grid;
import org.apache.commons.math3.util.FastMath;

import java.util.List;

/**
 * Shape signature of a row, compared row to row by the column continuity strategy.
 */
final class RowShape {

    static final int MAX_COL_COUNT_DELTA = 5;
    static final float MAX_NUMERIC_RATIO_DELTA = 0.4f;
    static final int MAX_SPAN_DELTA = 10;
    static final float MAX_DENSITY_DELTA = 0.3f;

    final int colCount;
    final float numericRatio;
    final float textRatio;
    final int columnSpan;
    final float density;

    private RowShape(int colCount, float numericRatio, float textRatio, int columnSpan, float density) {
        this.colCount = colCount;
        this.numericRatio = numericRatio;
        this.textRatio = textRatio;
        this.columnSpan = columnSpan;
        this.density = density;
    }

    static RowShape of(Grid grid, int row, int minCol, int maxCol) {
        List<Cell> cells = grid.getRowCells(row, minCol, maxCol);
        if (cells.isEmpty()) {
            return new RowShape(0, 0, 0, 0, 0);
        }
        int numeric = 0;
        int text = 0;
        for (Cell cell : cells) {
            if (cell.isNumberLike()) {
                ++numeric;
            } else if (cell.isText()) {
                ++text;
            }
        }
        int total = cells.size();
        int span = cells.get(total - 1).getCol() - cells.get(0).getCol() + 1;
        int possible = maxCol - minCol + 1;
        return new RowShape(total, (float) numeric / total, (float) text / total, span,
                possible > 0 ? (float) total / possible : 0);
    }

    boolean isTextOnly() {
        return colCount > 0 && numericRatio == 0 && textRatio > 0;
    }

    boolean changesSignificantly(RowShape next) {
        return FastMath.abs(colCount - next.colCount) > MAX_COL_COUNT_DELTA
                || FastMath.abs(numericRatio - next.numericRatio) > MAX_NUMERIC_RATIO_DELTA
                || FastMath.abs(columnSpan - next.columnSpan) > MAX_SPAN_DELTA
                || FastMath.abs(density - next.density) > MAX_DENSITY_DELTA;
    }

    @Override
    public String toString() {
        return String.format("RowShape{cols=%d, numeric=%.2f, text=%.2f, span=%d, density=%.2f}",
                colCount, numericRatio, textRatio, columnSpan, density);
    }

}
