package com.abcft.sheetextract.core.table.detectors;

import com.abcft.sheetextract.core.grid.Grid;
import com.abcft.sheetextract.core.grid.SheetBounds;
import com.abcft.sheetextract.core.table.TableExtractParameters;
import com.abcft.sheetextract.core.table.TableRegion;
import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits tables at blank rows.
 *
 * <p>A gap of {@link #DEFINITE_GAP} rows or more always separates two tables. A shorter gap separates
 * them only when the row after it starts a date header, or when the content pattern changes. A section
 * header after a short gap continues the current table, unless the rows following it show date headers.</p>
 */
public final class BlankRowSeparationDetectionAlgorithm implements DetectionAlgorithm {

    private static final Logger logger = LogManager.getLogger(BlankRowSeparationDetectionAlgorithm.class);

    public static final String ALGORITHM_NAME = "blank_row_separation";

    static final BlankRowSeparationDetectionAlgorithm INSTANCE = new BlankRowSeparationDetectionAlgorithm();

    static final int MIN_DATA_ROWS = 4;
    static final int DEFINITE_GAP = 4;
    static final int MIN_TABLES = 2;
    /**
     * Rows examined after a section header, looking for date headers.
     */
    static final int SECTION_LOOK_AHEAD = 3;

    private BlankRowSeparationDetectionAlgorithm() {
    }

    @Override
    public List<TableRegion> detect(Grid grid, SheetBounds bounds, TableExtractParameters params) {
        List<Integer> dataRows = TableRegionDetectionUtils.findDataRows(grid, bounds);
        if (dataRows.size() < MIN_DATA_ROWS) {
            return ImmutableList.of();
        }
        int labelCol = TableRegionDetectionUtils.findLabelColumn(grid, bounds);
        List<Integer> boundaries = new ArrayList<>();
        boundaries.add(dataRows.get(0));
        for (int i = 1; i < dataRows.size(); i++) {
            int prevRow = dataRows.get(i - 1);
            int nextRow = dataRows.get(i);
            int gap = nextRow - prevRow - 1;
            if (gap <= 0) {
                continue;
            }
            if (gap >= DEFINITE_GAP || isTableBoundary(grid, bounds, dataRows, i, labelCol)) {
                boundaries.add(nextRow);
            }
        }
        if (boundaries.size() < MIN_TABLES) {
            return ImmutableList.of();
        }
        logger.debug("Sheet {}: blank rows split tables at {}", grid.getSheetName(), boundaries);
        return TableRegionDetectionUtils.regionsFromBoundaries(grid, bounds, dataRows, boundaries,
                true, DetectionMethod.BLANK_ROW_SEPARATION);
    }

    /**
     * Decide whether a short gap before {@code dataRows[index]} is a table boundary.
     */
    private static boolean isTableBoundary(Grid grid, SheetBounds bounds, List<Integer> dataRows, int index,
                                           int labelCol) {
        int prevRow = dataRows.get(index - 1);
        int nextRow = dataRows.get(index);
        // 日期表头总是新表格的开始
        if (TableRegionDetectionUtils.isTemporalHeaderRow(grid, nextRow, bounds)) {
            return true;
        }
        if (TableRegionDetectionUtils.isSectionHeaderRow(grid, nextRow, bounds, labelCol)) {
            return sectionShowsTemporalHeader(grid, bounds, dataRows, index, labelCol);
        }
        RowContentPattern prev = RowContentPattern.of(grid, prevRow, bounds.getMinCol(), bounds.getMaxCol());
        RowContentPattern next = RowContentPattern.of(grid, nextRow, bounds.getMinCol(), bounds.getMaxCol());
        return RowContentPattern.differs(prev, next);
    }

    /**
     * Walk the rows following a section header (back to back section headers included) and look for
     * a date header row.
     */
    private static boolean sectionShowsTemporalHeader(Grid grid, SheetBounds bounds, List<Integer> dataRows,
                                                      int index, int labelCol) {
        int examined = 0;
        for (int j = index + 1; j < dataRows.size() && examined < SECTION_LOOK_AHEAD; j++) {
            int row = dataRows.get(j);
            if (row - dataRows.get(j - 1) - 1 >= DEFINITE_GAP) {
                break;
            }
            if (TableRegionDetectionUtils.isTemporalHeaderRow(grid, row, bounds)) {
                return true;
            }
            if (!TableRegionDetectionUtils.isSectionHeaderRow(grid, row, bounds, labelCol)) {
                ++examined;
            }
        }
        return false;
    }

}
