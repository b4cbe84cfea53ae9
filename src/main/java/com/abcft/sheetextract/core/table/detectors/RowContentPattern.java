package com.abcft.sheetextract.core.table.detectors;

import com.abcft.sheetextract.core.grid.Cell;
import com.abcft.sheetextract.core.grid.Grid;
import com.abcft.sheetextract.core.util.NumberUtil;

import java.util.List;

/**
 * Coarse content pattern of a row: populated cells, numeric majority and text labels.
 */
final class RowContentPattern {

    static final RowContentPattern EMPTY = new RowContentPattern(0, false, false);

    /**
     * Text labels are strings of at least this length.
     */
    private static final int TEXT_LABEL_MIN_LENGTH = 4;
    /**
     * A row has text labels when it has at least this number of them.
     */
    private static final int TEXT_LABEL_MIN_COUNT = 3;

    final int colCount;
    final boolean mostlyNumeric;
    final boolean hasTextLabels;

    private RowContentPattern(int colCount, boolean mostlyNumeric, boolean hasTextLabels) {
        this.colCount = colCount;
        this.mostlyNumeric = mostlyNumeric;
        this.hasTextLabels = hasTextLabels;
    }

    static RowContentPattern of(Grid grid, int row, int minCol, int maxCol) {
        List<Cell> cells = grid.getRowCells(row, minCol, maxCol);
        if (cells.isEmpty()) {
            return EMPTY;
        }
        int numericCount = 0;
        int textLabelCount = 0;
        for (Cell cell : cells) {
            Object value = cell.getValue();
            if (NumberUtil.isLooseNumeric(value)) {
                ++numericCount;
            } else if (value instanceof String && ((String) value).length() >= TEXT_LABEL_MIN_LENGTH) {
                ++textLabelCount;
            }
        }
        return new RowContentPattern(cells.size(),
                numericCount * 2 > cells.size(),
                textLabelCount >= TEXT_LABEL_MIN_COUNT);
    }

    /**
     * Header-like rows have text labels and no numeric majority.
     */
    boolean isHeaderLike() {
        return hasTextLabels && !mostlyNumeric;
    }

    /**
     * Whether moving from {@code prev} to {@code next} changes the content materially.
     */
    static boolean differs(RowContentPattern prev, RowContentPattern next) {
        if (Math.abs(prev.colCount - next.colCount) > 2) {
            return true;
        }
        if (prev.mostlyNumeric != next.mostlyNumeric) {
            return true;
        }
        return next.hasTextLabels && !prev.hasTextLabels;
    }

    @Override
    public String toString() {
        return "RowContentPattern{cols=" + colCount + ", numeric=" + mostlyNumeric + ", labels=" + hasTextLabels + '}';
    }

}
