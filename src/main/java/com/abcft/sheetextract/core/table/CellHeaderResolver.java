package com.abcft.sheetextract.core.table;

import com.abcft.sheetextract.core.grid.Cell;
import com.abcft.sheetextract.core.grid.Grid;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Attaches a {@link HeaderContext} to every data cell of a table.
 *
 * <p>Data cells sit at or after the first data row and column. Numbers, booleans and dates are
 * always data; strings only when longer than {@link #SHORT_TEXT_LENGTH}, shorter ones being
 * stray labels inside the data area.</p>
 */
public final class CellHeaderResolver {

    static final int SHORT_TEXT_LENGTH = 10;

    private CellHeaderResolver() {
    }

    /**
     * Resolve the headers of the data cells of a region.
     *
     * @return header contexts keyed by cell coordinate, in row then column order.
     */
    public static Map<String, HeaderContext> resolve(Grid grid, TableRegion region, HeaderInfo headerInfo) {
        Map<String, HeaderContext> contexts = new LinkedHashMap<>();
        if (region.isEmpty()) {
            return contexts;
        }
        Map<Integer, List<HeaderLevel>> columnHeaders = new LinkedHashMap<>();
        Map<Integer, List<HeaderLevel>> rowHeaders = new LinkedHashMap<>();
        for (Cell cell : grid.getCells(region.getStartRow(), region.getEndRow(),
                region.getStartCol(), region.getEndCol())) {
            if (!isDataCell(cell, headerInfo)) {
                continue;
            }
            List<HeaderLevel> above = columnHeaders.computeIfAbsent(cell.getCol(),
                    col -> levels(grid, headerInfo.getHeaderRows(), col, true));
            List<HeaderLevel> left = rowHeaders.computeIfAbsent(cell.getRow(),
                    row -> levels(grid, headerInfo.getHeaderColumns(), row, false));
            contexts.put(cell.getCoordinate(), new HeaderContext(above, left));
        }
        return contexts;
    }

    static boolean isDataCell(Cell cell, HeaderInfo headerInfo) {
        if (cell.getRow() < headerInfo.getDataStartRow() || cell.getCol() < headerInfo.getDataStartCol()) {
            return false;
        }
        if (cell.getValue() instanceof String) {
            return cell.getText().length() > SHORT_TEXT_LENGTH;
        }
        return true;
    }

    private static List<HeaderLevel> levels(Grid grid, List<Integer> headers, int index, boolean headerRows) {
        List<HeaderLevel> levels = new ArrayList<>(headers.size());
        for (int i = 0; i < headers.size(); i++) {
            int header = headers.get(i);
            Cell cell = headerRows ? grid.getCell(header, index) : grid.getCell(index, header);
            // 空的表头单元格不算一层，但层级编号仍按表头行（列）的位置
            if (cell != null) {
                levels.add(new HeaderLevel(i + 1, cell));
            }
        }
        return levels;
    }

}
