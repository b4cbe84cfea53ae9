package com.abcft.sheetextract.core.table.detectors;

import com.abcft.sheetextract.core.grid.Grid;
import com.abcft.sheetextract.core.grid.SheetBounds;
import com.abcft.sheetextract.core.table.TableExtractParameters;
import com.abcft.sheetextract.core.table.TableRegion;

import java.util.List;

/**
 * A table region detection strategy.
 *
 * Implementations are stateless, an empty list means the strategy does not apply.
 */
public interface DetectionAlgorithm {
    List<TableRegion> detect(Grid grid, SheetBounds bounds, TableExtractParameters params);
}
