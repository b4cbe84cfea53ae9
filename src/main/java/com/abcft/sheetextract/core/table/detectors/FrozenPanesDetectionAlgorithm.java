package com.abcft.sheetextract.core.table.detectors;

import com.abcft.sheetextract.core.grid.FrozenPanes;
import com.abcft.sheetextract.core.grid.Grid;
import com.abcft.sheetextract.core.grid.SheetBounds;
import com.abcft.sheetextract.core.table.TableExtractParameters;
import com.abcft.sheetextract.core.table.TableRegion;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Any frozen row or column makes the whole sheet a single table.
 */
public final class FrozenPanesDetectionAlgorithm implements DetectionAlgorithm {

    public static final String ALGORITHM_NAME = "frozen_panes";

    static final FrozenPanesDetectionAlgorithm INSTANCE = new FrozenPanesDetectionAlgorithm();

    private FrozenPanesDetectionAlgorithm() {
    }

    @Override
    public List<TableRegion> detect(Grid grid, SheetBounds bounds, TableExtractParameters params) {
        FrozenPanes frozen = grid.getFrozenPanes();
        if (!frozen.isFrozen()) {
            return ImmutableList.of();
        }
        return ImmutableList.of(new TableRegion(bounds.getMinRow(), bounds.getMaxRow(),
                bounds.getMinCol(), bounds.getMaxCol(), DetectionMethod.FROZEN_PANES,
                frozen.getFrozenRows(), frozen.getFrozenCols()));
    }

}
