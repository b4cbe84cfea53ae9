package com.abcft.sheetextract.core.table.detectors;

import com.abcft.sheetextract.core.grid.SheetBounds;
import com.abcft.sheetextract.core.table.TableRegion;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates detected regions: clip them to the sheet bounds, drop those left empty.
 */
public final class PostProcessTableRegionsAlgorithm {

    private static final Logger logger = LogManager.getLogger(PostProcessTableRegionsAlgorithm.class);

    private PostProcessTableRegionsAlgorithm() {
    }

    public static List<TableRegion> validateRegions(List<TableRegion> regions, SheetBounds bounds) {
        List<TableRegion> cleaned = new ArrayList<>(regions.size());
        for (TableRegion region : regions) {
            TableRegion clipped = region.clip(bounds);
            if (clipped.isEmpty()) {
                logger.debug("Dropped region {} outside of {}", region, bounds);
                continue;
            }
            cleaned.add(clipped);
        }
        return cleaned;
    }

}
