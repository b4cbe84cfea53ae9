package com.abcft.sheetextract.core.grid;

import com.google.common.collect.TreeBasedTable;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.poi.ss.util.CellReference;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * Builds the canonical {@link Grid} from either of the two cell inputs:
 * a coordinate keyed map of {@link CellRecord}s, or run-length encoded {@link CompactRow}s.
 *
 * Detection only ever sees the resulting grid.
 */
public final class GridNormalizer {

    private static final Logger logger = LogManager.getLogger(GridNormalizer.class);

    /**
     * Minimal size of a compact tuple carrying a run length, {@code [col, value, style, formula, run]}.
     */
    public static final int RUN_TUPLE_MIN_SIZE = 5;

    private GridNormalizer() {
    }

    /**
     * Normalize a coordinate keyed cell map.
     *
     * @param sheetName name of the sheet, for logging.
     * @param cells coordinate ({@code "B7"}) to cell record.
     * @param bounds sheet dimensions, computed from the retained cells if {@code null}.
     * @param frozenPanes frozen pane hint, might be {@code null}.
     * @return the grid.
     */
    public static Grid fromCellMap(String sheetName, Map<String, CellRecord> cells,
                                   @Nullable SheetBounds bounds, @Nullable FrozenPanes frozenPanes) {
        TreeBasedTable<Integer, Integer, Cell> table = TreeBasedTable.create();
        if (cells != null) {
            for (Map.Entry<String, CellRecord> entry : cells.entrySet()) {
                CellRecord record = entry.getValue();
                if (record == null || !isRetained(record.getValue())) {
                    continue;
                }
                int row;
                int col;
                if (record.getRow() != null && record.getColumn() != null) {
                    row = record.getRow();
                    col = record.getColumn();
                } else {
                    CellReference ref = parseCoordinate(entry.getKey());
                    if (ref == null) {
                        logger.debug("Sheet {}: skipped cell with invalid coordinate {}", sheetName, entry.getKey());
                        continue;
                    }
                    row = record.getRow() != null ? record.getRow() : ref.getRow() + 1;
                    col = record.getColumn() != null ? record.getColumn() : ref.getCol() + 1;
                }
                put(sheetName, table, new Cell(row, col, record.getValue()));
            }
        }
        return new Grid(sheetName, table, bounds != null ? bounds : computeBounds(table), frozenPanes);
    }

    /**
     * Normalize compact rows.
     *
     * Malformed tuples (fewer than two elements, or a non numeric column) are skipped one by one.
     *
     * @param sheetName name of the sheet, for logging.
     * @param rows the compact rows.
     * @param bounds sheet dimensions, computed from the retained cells if {@code null}.
     * @param frozenPanes frozen pane hint, might be {@code null}.
     * @return the grid.
     */
    public static Grid fromCompactRows(String sheetName, List<CompactRow> rows,
                                       @Nullable SheetBounds bounds, @Nullable FrozenPanes frozenPanes) {
        TreeBasedTable<Integer, Integer, Cell> table = TreeBasedTable.create();
        int skipped = 0;
        if (rows != null) {
            for (CompactRow compactRow : rows) {
                if (compactRow == null) {
                    continue;
                }
                for (List<Object> tuple : compactRow.getCells()) {
                    Cell cell = parseTuple(compactRow.getR(), tuple);
                    if (cell == null) {
                        if (tuple == null || tuple.size() < 2 || !(tuple.get(0) instanceof Number)) {
                            ++skipped;
                            logger.debug("Sheet {}: skipped malformed cell tuple {} in row {}",
                                    sheetName, tuple, compactRow.getR());
                        }
                        continue;
                    }
                    put(sheetName, table, cell);
                }
            }
        }
        if (skipped > 0) {
            logger.debug("Sheet {}: {} malformed cell tuples skipped", sheetName, skipped);
        }
        return new Grid(sheetName, table, bounds != null ? bounds : computeBounds(table), frozenPanes);
    }

    /**
     * Parse a single compact tuple.
     *
     * @return the cell, or {@code null} if the tuple is malformed or its value is empty.
     */
    @Nullable
    static Cell parseTuple(int row, @Nullable List<Object> tuple) {
        if (tuple == null || tuple.size() < 2) {
            return null;
        }
        Object colValue = tuple.get(0);
        if (!(colValue instanceof Number)) {
            return null;
        }
        Object value = tuple.get(1);
        if (!isRetained(value)) {
            return null;
        }
        return new Cell(row, ((Number) colValue).intValue(), value, runLengthOf(tuple));
    }

    /**
     * Run length of a tuple, 1 when the tuple is not a run.
     */
    static int runLengthOf(List<Object> tuple) {
        if (tuple.size() < RUN_TUPLE_MIN_SIZE) {
            return 1;
        }
        Object last = tuple.get(tuple.size() - 1);
        if (!(last instanceof Number)) {
            return 1;
        }
        double d = ((Number) last).doubleValue();
        if (d != Math.rint(d) || d <= 1) {
            return 1;
        }
        return (int) d;
    }

    /**
     * 只保留非空值，字符串去除空白后不能为空。
     */
    static boolean isRetained(@Nullable Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof String) {
            return StringUtils.isNotBlank((String) value);
        }
        return true;
    }

    @Nullable
    private static CellReference parseCoordinate(String coordinate) {
        if (StringUtils.isBlank(coordinate)) {
            return null;
        }
        try {
            CellReference ref = new CellReference(coordinate.trim());
            if (ref.getRow() < 0 || ref.getCol() < 0) {
                return null;
            }
            return ref;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static void put(String sheetName, TreeBasedTable<Integer, Integer, Cell> table, Cell cell) {
        Cell previous = table.put(cell.getRow(), cell.getCol(), cell);
        if (previous != null) {
            logger.debug("Sheet {}: cell {} replaced {}", sheetName, cell, previous);
        }
    }

    private static SheetBounds computeBounds(TreeBasedTable<Integer, Integer, Cell> table) {
        if (table.isEmpty()) {
            return SheetBounds.of(1, 1, 1, 1);
        }
        int minRow = table.rowKeySet().first();
        int maxRow = table.rowKeySet().last();
        int minCol = Integer.MAX_VALUE;
        int maxCol = Integer.MIN_VALUE;
        for (Cell cell : table.values()) {
            minCol = Math.min(minCol, cell.getCol());
            maxCol = Math.max(maxCol, cell.getLastCol());
        }
        return SheetBounds.of(minRow, minCol, maxRow, maxCol);
    }

}
