package com.abcft.sheetextract.core.grid;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.TreeBasedTable;

import javax.annotation.Nullable;
import java.util.*;

/**
 * Canonical sparse cell grid of one sheet.
 *
 * <p>Grids are immutable. Use {@link GridNormalizer} to build one from the raw cell input.</p>
 */
public final class Grid {

    private final String sheetName;
    private final TreeBasedTable<Integer, Integer, Cell> cells;  // 只读
    private final SheetBounds bounds;
    private final FrozenPanes frozenPanes;

    Grid(String sheetName, TreeBasedTable<Integer, Integer, Cell> cells, SheetBounds bounds, FrozenPanes frozenPanes) {
        this.sheetName = sheetName;
        this.cells = TreeBasedTable.create();
        this.cells.putAll(cells);
        this.bounds = Objects.requireNonNull(bounds, "bounds");
        this.frozenPanes = frozenPanes != null ? frozenPanes : FrozenPanes.NONE;
    }

    public String getSheetName() {
        return sheetName;
    }

    public SheetBounds getBounds() {
        return bounds;
    }

    public FrozenPanes getFrozenPanes() {
        return frozenPanes;
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    public int size() {
        return cells.size();
    }

    @Nullable
    public Cell getCell(int row, int col) {
        return cells.get(row, col);
    }

    /**
     * Whether a cell, or the start of a run, sits at the given position.
     */
    public boolean hasCell(int row, int col) {
        return cells.contains(row, col);
    }

    @Nullable
    public Object getValue(int row, int col) {
        Cell cell = cells.get(row, col);
        return cell != null ? cell.getValue() : null;
    }

    /**
     * Cells of a row between two columns (inclusive), ordered by column.
     */
    public List<Cell> getRowCells(int row, int minCol, int maxCol) {
        SortedMap<Integer, Cell> rowMap = cells.row(row);
        if (rowMap.isEmpty() || minCol > maxCol) {
            return ImmutableList.of();
        }
        return ImmutableList.copyOf(rowMap.subMap(minCol, maxCol + 1).values());
    }

    public boolean rowHasData(int row, int minCol, int maxCol) {
        SortedMap<Integer, Cell> rowMap = cells.row(row);
        return minCol <= maxCol && !rowMap.subMap(minCol, maxCol + 1).isEmpty();
    }

    public boolean colHasData(int col, int minRow, int maxRow) {
        if (minRow > maxRow) {
            return false;
        }
        for (Integer row : cells.rowKeySet().subSet(minRow, maxRow + 1)) {
            if (cells.contains(row, col)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Rows having at least one cell between the given columns, ascending.
     */
    public List<Integer> getPopulatedRows(int minRow, int maxRow, int minCol, int maxCol) {
        if (minRow > maxRow) {
            return ImmutableList.of();
        }
        List<Integer> rows = new ArrayList<>();
        for (Integer row : cells.rowKeySet().subSet(minRow, maxRow + 1)) {
            if (rowHasData(row, minCol, maxCol)) {
                rows.add(row);
            }
        }
        return rows;
    }

    /**
     * Columns having at least one cell between the given rows, ascending.
     */
    public SortedSet<Integer> getPopulatedColumns(int minRow, int maxRow, int minCol, int maxCol) {
        SortedSet<Integer> cols = new TreeSet<>();
        if (minRow > maxRow || minCol > maxCol) {
            return cols;
        }
        for (Integer row : cells.rowKeySet().subSet(minRow, maxRow + 1)) {
            cols.addAll(cells.row(row).subMap(minCol, maxCol + 1).keySet());
        }
        return cols;
    }

    /**
     * All cells in the rectangle, row by row.
     */
    public List<Cell> getCells(int minRow, int maxRow, int minCol, int maxCol) {
        List<Cell> result = new ArrayList<>();
        if (minRow > maxRow || minCol > maxCol) {
            return result;
        }
        for (Integer row : cells.rowKeySet().subSet(minRow, maxRow + 1)) {
            result.addAll(cells.row(row).subMap(minCol, maxCol + 1).values());
        }
        return result;
    }

    /**
     * Number of logical cells whose start lies in the rectangle, runs multiplied by their length.
     */
    public int countCells(int minRow, int maxRow, int minCol, int maxCol) {
        int count = 0;
        for (Cell cell : getCells(minRow, maxRow, minCol, maxCol)) {
            count += cell.getWeight();
        }
        return count;
    }

    /**
     * Same as {@link #countCells(int, int, int, int)}, numeric cells only.
     */
    public int countNumericCells(int minRow, int maxRow, int minCol, int maxCol) {
        int count = 0;
        for (Cell cell : getCells(minRow, maxRow, minCol, maxCol)) {
            if (cell.isNumeric()) {
                count += cell.getWeight();
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return "Grid{" + sheetName + ", bounds=" + bounds + ", cells=" + cells.size() + ", " + frozenPanes + '}';
    }

}
