package com.abcft.sheetextract.core.table.detectors;

import com.abcft.sheetextract.core.grid.Grid;
import com.abcft.sheetextract.core.grid.SheetBounds;
import com.abcft.sheetextract.core.table.TableExtractParameters;
import com.abcft.sheetextract.core.table.TableRegion;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits tables where the shape of consecutive rows changes significantly, see {@link RowShape}.
 *
 * A text-only row opening a table stays with the data row right below it, other rows split
 * wherever the shape changes.
 */
public final class ColumnContinuityDetectionAlgorithm implements DetectionAlgorithm {

    public static final String ALGORITHM_NAME = "column_continuity";

    static final ColumnContinuityDetectionAlgorithm INSTANCE = new ColumnContinuityDetectionAlgorithm();

    static final int MIN_DATA_ROWS = 3;
    static final int MIN_TABLES = 2;

    private ColumnContinuityDetectionAlgorithm() {
    }

    @Override
    public List<TableRegion> detect(Grid grid, SheetBounds bounds, TableExtractParameters params) {
        List<Integer> dataRows = TableRegionDetectionUtils.findDataRows(grid, bounds);
        if (dataRows.size() < MIN_DATA_ROWS) {
            return ImmutableList.of();
        }
        List<RowShape> shapes = new ArrayList<>(dataRows.size());
        for (int row : dataRows) {
            shapes.add(RowShape.of(grid, row, bounds.getMinCol(), bounds.getMaxCol()));
        }
        List<Integer> boundaries = new ArrayList<>();
        boundaries.add(dataRows.get(0));
        int blockStart = 0;
        for (int i = 1; i < dataRows.size(); i++) {
            RowShape prev = shapes.get(i - 1);
            RowShape current = shapes.get(i);
            // 表头行和紧跟其后的数据行不拆开
            if (isHeaderOverData(prev, current, i - 1 == blockStart)) {
                continue;
            }
            if (prev.changesSignificantly(current)) {
                boundaries.add(dataRows.get(i));
                blockStart = i;
            }
        }
        if (boundaries.size() < MIN_TABLES) {
            return ImmutableList.of();
        }
        return TableRegionDetectionUtils.regionsFromBoundaries(grid, bounds, dataRows, boundaries,
                false, DetectionMethod.COLUMN_CONTINUITY);
    }

    /**
     * A single text-only row opening a block, directly followed by a row that is not text-only.
     */
    static boolean isHeaderOverData(RowShape prev, RowShape current, boolean prevOpensBlock) {
        return prevOpensBlock && prev.isTextOnly() && !current.isTextOnly();
    }

}
