package com.abcft.sheetextract.core.table;

import com.abcft.sheetextract.core.grid.Cell;
import com.abcft.sheetextract.core.grid.Grid;

import java.util.*;

/**
 * Tables with per cell maps for every column and row of the region, and the header context of
 * each data cell.
 */
public final class VerboseTableAssembler implements TableAssembler {

    public static final VerboseTableAssembler INSTANCE = new VerboseTableAssembler();

    private VerboseTableAssembler() {
    }

    @Override
    public Table assemble(Grid grid, TableRegion region, int index) {
        HeaderInfo headerInfo = HeaderResolver.resolve(region, grid.getFrozenPanes());
        LabelBuilder labelBuilder = VerboseLabelBuilder.INSTANCE;
        SortedMap<Integer, String> columnLabels = labelBuilder.buildColumnLabels(grid, region, headerInfo);
        SortedMap<Integer, String> rowLabels = labelBuilder.buildRowLabels(grid, region, headerInfo);

        Map<Integer, Map<String, Object>> columnCells = new TreeMap<>();
        Map<Integer, Map<String, Object>> rowCells = new TreeMap<>();
        for (Cell cell : grid.getCells(region.getStartRow(), region.getEndRow(), region.getStartCol(), region.getEndCol())) {
            columnCells.computeIfAbsent(cell.getCol(), k -> new LinkedHashMap<>()).put(cell.getCoordinate(), cell.getValue());
            rowCells.computeIfAbsent(cell.getRow(), k -> new LinkedHashMap<>()).put(cell.getCoordinate(), cell.getValue());
        }

        List<TableColumn> columns = new ArrayList<>();
        for (Map.Entry<Integer, String> entry : columnLabels.entrySet()) {
            int col = entry.getKey();
            columns.add(new TableColumn(col, entry.getValue(), headerInfo.isHeaderColumn(col),
                    columnCells.getOrDefault(col, Collections.emptyMap())));
        }
        List<TableRow> rows = new ArrayList<>();
        for (Map.Entry<Integer, String> entry : rowLabels.entrySet()) {
            int row = entry.getKey();
            rows.add(new TableRow(row, entry.getValue(), headerInfo.isHeaderRow(row),
                    rowCells.getOrDefault(row, Collections.emptyMap())));
        }
        TableMetadata metadata = new TableMetadata(region.getDetectionMethodName(),
                grid.countCells(region.getStartRow(), region.getEndRow(), region.getStartCol(), region.getEndCol()),
                grid.countNumericCells(region.getStartRow(), region.getEndRow(), region.getStartCol(), region.getEndCol()));
        return new Table("table_" + (index + 1), "Table " + (index + 1), grid.getSheetName(), null,
                OutputFormat.VERBOSE, region, headerInfo, columns, rows, metadata,
                CellHeaderResolver.resolve(grid, region, headerInfo));
    }

}
