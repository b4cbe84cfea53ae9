package com.abcft.sheetextract.core.table;

import com.abcft.sheetextract.core.grid.Grid;
import com.abcft.sheetextract.core.grid.SheetBounds;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Labels joined top down with {@code " | "}. Only data rows present in the sheet get a row label.
 */
public final class CompactLabelBuilder implements LabelBuilder {

    public static final CompactLabelBuilder INSTANCE = new CompactLabelBuilder();

    private CompactLabelBuilder() {
    }

    @Override
    public SortedMap<Integer, String> buildColumnLabels(Grid grid, TableRegion region, HeaderInfo headerInfo) {
        SortedMap<Integer, String> labels = new TreeMap<>();
        for (int col = region.getStartCol(); col <= region.getEndCol(); col++) {
            List<String> parts = new ArrayList<>();
            for (int headerRow : headerInfo.getHeaderRows()) {
                addText(parts, grid, headerRow, col);
            }
            labels.put(col, join(parts));
        }
        return labels;
    }

    @Override
    public SortedMap<Integer, String> buildRowLabels(Grid grid, TableRegion region, HeaderInfo headerInfo) {
        SheetBounds bounds = grid.getBounds();
        SortedMap<Integer, String> labels = new TreeMap<>();
        for (int row : grid.getPopulatedRows(headerInfo.getDataStartRow(), region.getEndRow(),
                bounds.getMinCol(), bounds.getMaxCol())) {
            List<String> parts = new ArrayList<>();
            for (int headerCol : headerInfo.getHeaderColumns()) {
                addText(parts, grid, row, headerCol);
            }
            labels.put(row, join(parts));
        }
        return labels;
    }

    private static void addText(List<String> parts, Grid grid, int row, int col) {
        String text = VerboseLabelBuilder.textAt(grid, row, col);
        if (StringUtils.isNotEmpty(text)) {
            parts.add(text);
        }
    }

    private static String join(List<String> parts) {
        return parts.isEmpty() ? UNLABELED : String.join(HEADER_COLUMN_SEPARATOR, parts);
    }

}
