package com.abcft.sheetextract.core.table;

import com.abcft.sheetextract.core.grid.Grid;

/**
 * Turns a detected region into a {@link Table}.
 */
public interface TableAssembler {

    /**
     * Assemble the table of a region.
     *
     * @param grid the sheet.
     * @param region the detected region.
     * @param index 0-based position of the region in detection order.
     * @return the table.
     */
    Table assemble(Grid grid, TableRegion region, int index);

    static TableAssembler forFormat(OutputFormat format) {
        return format == OutputFormat.COMPACT ? CompactTableAssembler.INSTANCE : VerboseTableAssembler.INSTANCE;
    }

}
