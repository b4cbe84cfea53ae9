package com.abcft.sheetextract.core.table.detectors;

import com.abcft.sheetextract.core.grid.Grid;
import com.abcft.sheetextract.core.grid.SheetBounds;
import com.abcft.sheetextract.core.table.TableExtractParameters;
import com.abcft.sheetextract.core.table.TableRegion;
import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Runs the detection strategies in {@link DetectionMethod} order, the first non-empty result wins.
 * Results of different strategies are never merged.
 */
public final class TableRegionDetector {

    private static final Logger logger = LogManager.getLogger(TableRegionDetector.class);

    public static final TableRegionDetector INSTANCE = new TableRegionDetector();

    private TableRegionDetector() {
    }

    /**
     * Detect table regions of a sheet.
     *
     * @param grid the sheet.
     * @param params the parameters.
     * @return validated regions in detection order, empty only for an empty sheet.
     */
    public List<TableRegion> detect(Grid grid, TableExtractParameters params) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(params, "params");
        SheetBounds bounds = grid.getBounds();
        for (DetectionMethod method : DetectionMethod.values()) {
            List<TableRegion> regions = method.getDetectionAlgorithm().detect(grid, bounds, params);
            if (regions.isEmpty()) {
                continue;
            }
            List<TableRegion> validated = PostProcessTableRegionsAlgorithm.validateRegions(regions, bounds);
            if (validated.isEmpty()) {
                logger.debug("Sheet {}: {} regions were all out of bounds", grid.getSheetName(),
                        method.getAlgorithmName());
                continue;
            }
            logger.debug("Sheet {}: {} found {} regions", grid.getSheetName(),
                    method.getAlgorithmName(), validated.size());
            return validated;
        }
        logger.debug("Sheet {}: no table found", grid.getSheetName());
        return ImmutableList.of();
    }

}
