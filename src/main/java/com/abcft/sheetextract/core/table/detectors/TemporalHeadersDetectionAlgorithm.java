package com.abcft.sheetextract.core.table.detectors;

import com.abcft.sheetextract.core.grid.Grid;
import com.abcft.sheetextract.core.grid.SheetBounds;
import com.abcft.sheetextract.core.table.TableExtractParameters;
import com.abcft.sheetextract.core.table.TableRegion;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * Time series tables: rows of date headers near the top of the sheet each start a table.
 */
public final class TemporalHeadersDetectionAlgorithm implements DetectionAlgorithm {

    public static final String ALGORITHM_NAME = "temporal_headers";

    static final TemporalHeadersDetectionAlgorithm INSTANCE = new TemporalHeadersDetectionAlgorithm();

    static final int SCAN_ROWS = 5;
    /**
     * A gap of this number of blank rows ends a time series table.
     */
    static final int END_GAP = 2;

    private TemporalHeadersDetectionAlgorithm() {
    }

    @Override
    public List<TableRegion> detect(Grid grid, SheetBounds bounds, TableExtractParameters params) {
        int lastScanRow = Math.min(bounds.getMinRow() + SCAN_ROWS - 1, bounds.getMaxRow());
        List<TableRegion> regions = new ArrayList<>();
        for (int row = bounds.getMinRow(); row <= lastScanRow; row++) {
            if (!TableRegionDetectionUtils.isTemporalHeaderRow(grid, row, bounds)) {
                continue;
            }
            int endRow = findTableEnd(grid, row, bounds);
            if (endRow > row) {
                regions.add(new TableRegion(row, endRow, bounds.getMinCol(), bounds.getMaxCol(),
                        DetectionMethod.TEMPORAL_HEADERS));
            }
        }
        return regions;
    }

    private static int findTableEnd(Grid grid, int headerRow, SheetBounds bounds) {
        int lastDataRow = headerRow;
        for (int row = headerRow + 1; row <= bounds.getMaxRow(); row++) {
            if (grid.rowHasData(row, bounds.getMinCol(), bounds.getMaxCol())) {
                if (TableRegionDetectionUtils.isTemporalHeaderRow(grid, row, bounds)) {
                    break;
                }
                lastDataRow = row;
            } else {
                int nextDataRow = TableRegionDetectionUtils.findNextDataRow(grid, row + 1, bounds);
                if (nextDataRow < 0 || nextDataRow - row >= END_GAP) {
                    break;
                }
            }
        }
        return lastDataRow;
    }

}
