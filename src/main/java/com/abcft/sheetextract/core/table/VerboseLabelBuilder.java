package com.abcft.sheetextract.core.table;

import com.abcft.sheetextract.core.grid.Cell;
import com.abcft.sheetextract.core.grid.Grid;
import com.google.common.collect.Lists;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Labels with the most granular header first: header values are read bottom up and joined by a space,
 * so a month row under a year row gives {@code "Jan 2023"}.
 */
public final class VerboseLabelBuilder implements LabelBuilder {

    public static final VerboseLabelBuilder INSTANCE = new VerboseLabelBuilder();

    private VerboseLabelBuilder() {
    }

    @Override
    public SortedMap<Integer, String> buildColumnLabels(Grid grid, TableRegion region, HeaderInfo headerInfo) {
        SortedMap<Integer, String> labels = new TreeMap<>();
        for (int col = region.getStartCol(); col <= region.getEndCol(); col++) {
            String label = joinReversed(grid, headerInfo.getHeaderRows(), col);
            labels.put(col, StringUtils.isEmpty(label) ? UNLABELED : label);
        }
        return labels;
    }

    /**
     * Rows of the region keyed by row. With frozen header rows stacked on each other, the header
     * column values of the whole header block label every data row.
     */
    @Override
    public SortedMap<Integer, String> buildRowLabels(Grid grid, TableRegion region, HeaderInfo headerInfo) {
        boolean frozenBlock = grid.getFrozenPanes().getFrozenRows() > 0 && headerInfo.getHeaderRows().size() > 1;
        SortedMap<Integer, String> labels = new TreeMap<>();
        for (int row = region.getStartRow(); row <= region.getEndRow(); row++) {
            boolean dataRow = row >= headerInfo.getDataStartRow();
            List<String> parts = new ArrayList<>();
            for (int headerCol : headerInfo.getHeaderColumns()) {
                String part;
                if (frozenBlock && dataRow) {
                    part = joinReversed(grid, headerInfo.getHeaderRows(), headerCol);
                } else {
                    part = textAt(grid, row, headerCol);
                }
                if (StringUtils.isNotEmpty(part)) {
                    parts.add(part);
                }
            }
            labels.put(row, parts.isEmpty() ? UNLABELED : String.join(HEADER_COLUMN_SEPARATOR, parts));
        }
        return labels;
    }

    private static String joinReversed(Grid grid, List<Integer> headerRows, int col) {
        List<String> values = new ArrayList<>();
        for (int headerRow : headerRows) {
            String text = textAt(grid, headerRow, col);
            if (StringUtils.isNotEmpty(text)) {
                values.add(text);
            }
        }
        return String.join(" ", Lists.reverse(values));
    }

    static String textAt(Grid grid, int row, int col) {
        Cell cell = grid.getCell(row, col);
        return cell != null ? cell.getText() : null;
    }

}
