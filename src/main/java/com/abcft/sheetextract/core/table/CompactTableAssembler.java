package com.abcft.sheetextract.core.table;

import com.abcft.sheetextract.core.grid.Grid;
import com.google.common.collect.ImmutableMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Tables with cell counts only. Runs count once per covered column, and a title found on the first
 * row of the region is taken out of it, unless that row is a frozen header row.
 */
public final class CompactTableAssembler implements TableAssembler {

    private static final Logger logger = LogManager.getLogger(CompactTableAssembler.class);

    public static final CompactTableAssembler INSTANCE = new CompactTableAssembler();

    private CompactTableAssembler() {
    }

    @Override
    public Table assemble(Grid grid, TableRegion detected, int index) {
        TableRegion region = detected;
        TableTitle title = TableTitle.findTitle(grid, detected);
        if (title != null) {
            logger.debug("Sheet {}: title of table {} is {}", grid.getSheetName(), index + 1, title);
            // 冻结行属于表头，不能移出表格
            if (title.isInside(detected) && grid.getFrozenPanes().getFrozenRows() == 0) {
                region = detected.withStartRow(detected.getStartRow() + 1);
            }
        }
        HeaderInfo headerInfo = HeaderResolver.resolve(region, grid.getFrozenPanes());
        LabelBuilder labelBuilder = CompactLabelBuilder.INSTANCE;
        SortedMap<Integer, String> columnLabels = labelBuilder.buildColumnLabels(grid, region, headerInfo);
        SortedMap<Integer, String> rowLabels = labelBuilder.buildRowLabels(grid, region, headerInfo);

        List<TableColumn> columns = new ArrayList<>();
        for (Map.Entry<Integer, String> entry : columnLabels.entrySet()) {
            int col = entry.getKey();
            columns.add(new TableColumn(col, entry.getValue(), headerInfo.isHeaderColumn(col),
                    grid.countCells(region.getStartRow(), region.getEndRow(), col, col)));
        }
        List<TableRow> rows = new ArrayList<>();
        for (Map.Entry<Integer, String> entry : rowLabels.entrySet()) {
            int row = entry.getKey();
            rows.add(new TableRow(row, entry.getValue(), headerInfo.isHeaderRow(row),
                    grid.countCells(row, row, region.getStartCol(), region.getEndCol())));
        }
        TableMetadata metadata = new TableMetadata(region.getDetectionMethodName(),
                grid.countCells(region.getStartRow(), region.getEndRow(), region.getStartCol(), region.getEndCol()),
                grid.countNumericCells(region.getStartRow(), region.getEndRow(), region.getStartCol(), region.getEndCol()));
        return new Table("t" + (index + 1), "Table " + (index + 1), grid.getSheetName(),
                title != null ? title.getText() : null,
                OutputFormat.COMPACT, region, headerInfo, columns, rows, metadata, ImmutableMap.of());
    }

}
