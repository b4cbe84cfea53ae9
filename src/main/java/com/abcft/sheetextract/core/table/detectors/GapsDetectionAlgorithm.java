package com.abcft.sheetextract.core.table.detectors;

import com.abcft.sheetextract.core.grid.Grid;
import com.abcft.sheetextract.core.grid.SheetBounds;
import com.abcft.sheetextract.core.table.TableExtractParameters;
import com.abcft.sheetextract.core.table.TableRegion;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed threshold blank row splitter, only used when {@code table_detection.use_gaps} is on.
 *
 * @see TableExtractParameters#effectiveGapThreshold()
 */
public final class GapsDetectionAlgorithm implements DetectionAlgorithm {

    public static final String ALGORITHM_NAME = "gaps";

    static final GapsDetectionAlgorithm INSTANCE = new GapsDetectionAlgorithm();

    private GapsDetectionAlgorithm() {
    }

    @Override
    public List<TableRegion> detect(Grid grid, SheetBounds bounds, TableExtractParameters params) {
        if (!params.useGaps) {
            return ImmutableList.of();
        }
        List<Integer> dataRows = TableRegionDetectionUtils.findDataRows(grid, bounds);
        if (dataRows.size() < 2) {
            return ImmutableList.of();
        }
        int threshold = params.effectiveGapThreshold();
        List<Integer> boundaries = new ArrayList<>();
        boundaries.add(dataRows.get(0));
        for (int i = 1; i < dataRows.size(); i++) {
            if (dataRows.get(i) - dataRows.get(i - 1) - 1 >= threshold) {
                boundaries.add(dataRows.get(i));
            }
        }
        return TableRegionDetectionUtils.regionsFromBoundaries(grid, bounds, dataRows, boundaries,
                true, DetectionMethod.GAPS);
    }

}
