package com.abcft.sheetextract.core.table;

import com.abcft.sheetextract.core.grid.Grid;

import java.util.SortedMap;

/**
 * Builds column and row labels out of the header values of a region.
 */
public interface LabelBuilder {

    /**
     * Label of positions without any header value.
     */
    String UNLABELED = "unlabeled";

    String HEADER_COLUMN_SEPARATOR = " | ";

    /**
     * Labels of every column of the region, keyed by column.
     */
    SortedMap<Integer, String> buildColumnLabels(Grid grid, TableRegion region, HeaderInfo headerInfo);

    /**
     * Labels of the labelled rows of the region, keyed by row.
     */
    SortedMap<Integer, String> buildRowLabels(Grid grid, TableRegion region, HeaderInfo headerInfo);

}
