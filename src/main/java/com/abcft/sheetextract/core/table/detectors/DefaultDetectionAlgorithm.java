package com.abcft.sheetextract.core.table.detectors;

import com.abcft.sheetextract.core.grid.Grid;
import com.abcft.sheetextract.core.grid.SheetBounds;
import com.abcft.sheetextract.core.table.TableExtractParameters;
import com.abcft.sheetextract.core.table.TableRegion;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Last resort: any non-empty sheet is one table.
 */
public final class DefaultDetectionAlgorithm implements DetectionAlgorithm {

    public static final String ALGORITHM_NAME = "default";

    static final DefaultDetectionAlgorithm INSTANCE = new DefaultDetectionAlgorithm();

    private DefaultDetectionAlgorithm() {
    }

    @Override
    public List<TableRegion> detect(Grid grid, SheetBounds bounds, TableExtractParameters params) {
        if (grid.isEmpty()) {
            return ImmutableList.of();
        }
        return ImmutableList.of(TableRegion.of(bounds, DetectionMethod.DEFAULT));
    }

}
