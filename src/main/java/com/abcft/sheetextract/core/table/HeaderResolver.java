package com.abcft.sheetextract.core.table;

import com.abcft.sheetextract.core.grid.FrozenPanes;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which rows and columns of a region are headers.
 *
 * <p>Frozen rows/columns are authoritative. Without them the first row (column) is the header, as long
 * as the region spans more than one row (column).</p>
 */
public final class HeaderResolver {

    private HeaderResolver() {
    }

    public static HeaderInfo resolve(TableRegion region, FrozenPanes frozenPanes) {
        FrozenPanes frozen = frozenPanes != null ? frozenPanes : FrozenPanes.NONE;
        if (region.isEmpty()) {
            return new HeaderInfo(new ArrayList<>(), new ArrayList<>(), region.getStartRow(), region.getStartCol());
        }
        List<Integer> headerRows = headerIndices(region.getStartRow(), region.getEndRow(), frozen.getFrozenRows());
        List<Integer> headerCols = headerIndices(region.getStartCol(), region.getEndCol(), frozen.getFrozenCols());
        return new HeaderInfo(headerRows, headerCols,
                region.getStartRow() + headerRows.size(),
                region.getStartCol() + headerCols.size());
    }

    private static List<Integer> headerIndices(int start, int end, int frozen) {
        List<Integer> indices = new ArrayList<>();
        if (frozen > 0) {
            for (int i = start; i < start + frozen && i <= end; i++) {
                indices.add(i);
            }
        } else if (start < end) {
            indices.add(start);
        }
        return indices;
    }

}
