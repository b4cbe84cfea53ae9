package com.abcft.sheetextract.core.table.detectors;

import com.abcft.sheetextract.core.grid.Grid;
import com.abcft.sheetextract.core.grid.SheetBounds;
import com.abcft.sheetextract.core.table.TableExtractParameters;
import com.abcft.sheetextract.core.table.TableRegion;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The whole sheet is one table when it has a table-like size.
 */
public final class ContentStructureDetectionAlgorithm implements DetectionAlgorithm {

    public static final String ALGORITHM_NAME = "content_structure";

    static final ContentStructureDetectionAlgorithm INSTANCE = new ContentStructureDetectionAlgorithm();

    static final int MIN_ROWS = 3;
    static final int MIN_COLUMNS = 2;

    private ContentStructureDetectionAlgorithm() {
    }

    @Override
    public List<TableRegion> detect(Grid grid, SheetBounds bounds, TableExtractParameters params) {
        int rows = TableRegionDetectionUtils.findDataRows(grid, bounds).size();
        int cols = grid.getPopulatedColumns(bounds.getMinRow(), bounds.getMaxRow(),
                bounds.getMinCol(), bounds.getMaxCol()).size();
        if (rows >= MIN_ROWS && cols >= MIN_COLUMNS) {
            return ImmutableList.of(TableRegion.of(bounds, DetectionMethod.CONTENT_STRUCTURE));
        }
        return ImmutableList.of();
    }

}
