package com.abcft.sheetextract.core.table.detectors;

import com.abcft.sheetextract.core.grid.Cell;
import com.abcft.sheetextract.core.grid.Grid;
import com.abcft.sheetextract.core.grid.SheetBounds;
import com.abcft.sheetextract.core.table.TableRegion;
import com.abcft.sheetextract.core.util.NumberUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.regex.Pattern;

/**
 * Helpers shared by the detection strategies.
 */
public final class TableRegionDetectionUtils {

    static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    static final Pattern MONTH_N = Pattern.compile("month\\s+\\d+", Pattern.CASE_INSENSITIVE);

    /**
     * A row is a temporal header row if at least this share of its non-label cells are dates.
     */
    static final float TEMPORAL_HEADER_RATIO = 0.25f;

    private TableRegionDetectionUtils() {
    }

    public static List<Integer> findDataRows(Grid grid, SheetBounds bounds) {
        return grid.getPopulatedRows(bounds.getMinRow(), bounds.getMaxRow(), bounds.getMinCol(), bounds.getMaxCol());
    }

    /**
     * Next row having data, starting from (and including) {@code startRow}.
     *
     * @return the row, or -1 if none.
     */
    public static int findNextDataRow(Grid grid, int startRow, SheetBounds bounds) {
        List<Integer> rows = grid.getPopulatedRows(startRow, bounds.getMaxRow(), bounds.getMinCol(), bounds.getMaxCol());
        return rows.isEmpty() ? -1 : rows.get(0);
    }

    /**
     * Leftmost populated column of the sheet, the one carrying row labels.
     */
    public static int findLabelColumn(Grid grid, SheetBounds bounds) {
        SortedSet<Integer> cols = grid.getPopulatedColumns(bounds.getMinRow(), bounds.getMaxRow(),
                bounds.getMinCol(), bounds.getMaxCol());
        return cols.isEmpty() ? bounds.getMinCol() : cols.first();
    }

    /**
     * Build regions out of boundary rows: each region runs from its boundary row to the last data
     * row before the next boundary, columns narrowed to the data of that row range when asked.
     */
    public static List<TableRegion> regionsFromBoundaries(Grid grid, SheetBounds bounds,
                                                          List<Integer> dataRows, List<Integer> boundaries,
                                                          boolean narrowColumns, DetectionMethod method) {
        List<TableRegion> regions = new ArrayList<>(boundaries.size());
        for (int i = 0; i < boundaries.size(); i++) {
            int startRow = boundaries.get(i);
            int endRow = startRow;
            if (i < boundaries.size() - 1) {
                int nextBoundary = boundaries.get(i + 1);
                for (int row : dataRows) {
                    if (row >= startRow && row < nextBoundary) {
                        endRow = row;
                    }
                }
            } else {
                endRow = dataRows.get(dataRows.size() - 1);
            }
            if (endRow < startRow) {
                continue;
            }
            if (narrowColumns) {
                regions.add(narrowColumns(grid, bounds, startRow, endRow, method));
            } else {
                regions.add(new TableRegion(startRow, endRow, bounds.getMinCol(), bounds.getMaxCol(), method));
            }
        }
        return regions;
    }

    /**
     * Region of the given rows with the columns narrowed to those actually having data.
     */
    public static TableRegion narrowColumns(Grid grid, SheetBounds bounds, int startRow, int endRow,
                                            DetectionMethod method) {
        SortedSet<Integer> cols = grid.getPopulatedColumns(startRow, endRow, bounds.getMinCol(), bounds.getMaxCol());
        if (cols.isEmpty()) {
            return new TableRegion(startRow, endRow, bounds.getMinCol(), bounds.getMaxCol(), method);
        }
        return new TableRegion(startRow, endRow, cols.first(), cols.last(), method);
    }

    /**
     * Whether a row carries date headers: ISO dates, {@code Month N} labels or date values.
     *
     * The leading row label is not counted when the row has other cells.
     */
    public static boolean isTemporalHeaderRow(Grid grid, int row, SheetBounds bounds) {
        List<Cell> cells = grid.getRowCells(row, bounds.getMinCol(), bounds.getMaxCol());
        if (cells.isEmpty()) {
            return false;
        }
        List<Cell> candidates = cells.size() > 1 ? cells.subList(1, cells.size()) : cells;
        int dateCount = 0;
        for (Cell cell : candidates) {
            if (isTemporal(cell.getValue())) {
                ++dateCount;
            }
        }
        return dateCount > 0 && dateCount >= TEMPORAL_HEADER_RATIO * candidates.size();
    }

    static boolean isTemporal(Object value) {
        if (NumberUtil.isTemporalValue(value)) {
            return true;
        }
        if (value instanceof String) {
            String text = (String) value;
            return ISO_DATE.matcher(text).find() || MONTH_N.matcher(text).find();
        }
        return false;
    }

    /**
     * A row with a single text cell in the label column and nothing else.
     */
    public static boolean isSectionHeaderRow(Grid grid, int row, SheetBounds bounds, int labelCol) {
        List<Cell> cells = grid.getRowCells(row, bounds.getMinCol(), bounds.getMaxCol());
        if (cells.size() != 1) {
            return false;
        }
        Cell cell = cells.get(0);
        return cell.getCol() == labelCol && cell.isText() && !cell.isNumberLike();
    }

}
