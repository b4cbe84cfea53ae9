package com.abcft.sheetextract.core.table.detectors;

import com.abcft.sheetextract.core.grid.Grid;
import com.abcft.sheetextract.core.grid.SheetBounds;
import com.abcft.sheetextract.core.table.TableExtractParameters;
import com.abcft.sheetextract.core.table.TableRegion;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Placeholder for detection by cell styling (borders, fills, bold headers).
 *
 * Grids carry no styling yet, so this never matches.
 */
public final class FormattingDetectionAlgorithm implements DetectionAlgorithm {

    public static final String ALGORITHM_NAME = "formatting";

    static final FormattingDetectionAlgorithm INSTANCE = new FormattingDetectionAlgorithm();

    private FormattingDetectionAlgorithm() {
    }

    @Override
    public List<TableRegion> detect(Grid grid, SheetBounds bounds, TableExtractParameters params) {
        return ImmutableList.of();
    }

}
