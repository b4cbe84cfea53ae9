package com.abcft.sheetextract.core.table.detectors;

import com.abcft.sheetextract.core.grid.Grid;
import com.abcft.sheetextract.core.grid.SheetBounds;
import com.abcft.sheetextract.core.table.TableExtractParameters;
import com.abcft.sheetextract.core.table.TableRegion;

import java.util.ArrayList;
import java.util.List;

/**
 * Tables headed by a block of stacked header rows near the top of the sheet.
 */
public final class MultiRowHeadersDetectionAlgorithm implements DetectionAlgorithm {

    public static final String ALGORITHM_NAME = "multirow_headers";

    static final MultiRowHeadersDetectionAlgorithm INSTANCE = new MultiRowHeadersDetectionAlgorithm();

    static final int SCAN_ROWS = 11;
    static final int MIN_HEADER_BLOCK_ROWS = 2;
    static final int MIN_HEADER_COLUMNS = 3;
    /**
     * A gap wider than this ends the table.
     */
    static final int MAX_INNER_GAP = 2;
    static final int NEW_BLOCK_LOOK_AHEAD = 3;

    private MultiRowHeadersDetectionAlgorithm() {
    }

    @Override
    public List<TableRegion> detect(Grid grid, SheetBounds bounds, TableExtractParameters params) {
        int lastScanRow = Math.min(bounds.getMinRow() + SCAN_ROWS - 1, bounds.getMaxRow());
        List<int[]> blocks = findHeaderBlocks(grid, bounds, bounds.getMinRow(), lastScanRow);
        List<TableRegion> regions = new ArrayList<>();
        for (int[] block : blocks) {
            int dataStart = TableRegionDetectionUtils.findNextDataRow(grid, block[1] + 1, bounds);
            if (dataStart < 0) {
                continue;
            }
            int tableEnd = findTableEnd(grid, dataStart, bounds);
            if (tableEnd >= dataStart) {
                regions.add(new TableRegion(block[0], tableEnd, bounds.getMinCol(), bounds.getMaxCol(),
                        DetectionMethod.MULTIROW_HEADERS));
            }
        }
        return regions;
    }

    private static boolean isHeaderRow(Grid grid, int row, SheetBounds bounds) {
        RowContentPattern pattern = RowContentPattern.of(grid, row, bounds.getMinCol(), bounds.getMaxCol());
        return pattern.isHeaderLike() && pattern.colCount >= MIN_HEADER_COLUMNS;
    }

    /**
     * Blocks of consecutive header rows, as {@code [startRow, endRow]}.
     */
    private static List<int[]> findHeaderBlocks(Grid grid, SheetBounds bounds, int minRow, int maxRow) {
        List<int[]> blocks = new ArrayList<>();
        int blockStart = -1;
        for (int row = minRow; row <= maxRow; row++) {
            boolean header = grid.rowHasData(row, bounds.getMinCol(), bounds.getMaxCol())
                    && isHeaderRow(grid, row, bounds);
            if (header) {
                if (blockStart < 0) {
                    blockStart = row;
                }
            } else if (blockStart >= 0) {
                if (row - blockStart >= MIN_HEADER_BLOCK_ROWS) {
                    blocks.add(new int[]{blockStart, row - 1});
                }
                blockStart = -1;
            }
        }
        if (blockStart >= 0 && maxRow - blockStart + 1 >= MIN_HEADER_BLOCK_ROWS) {
            blocks.add(new int[]{blockStart, maxRow});
        }
        return blocks;
    }

    private static int findTableEnd(Grid grid, int dataStart, SheetBounds bounds) {
        int lastDataRow = dataStart;
        for (int row = dataStart + 1; row <= bounds.getMaxRow(); row++) {
            if (grid.rowHasData(row, bounds.getMinCol(), bounds.getMaxCol())) {
                RowContentPattern pattern = RowContentPattern.of(grid, row, bounds.getMinCol(), bounds.getMaxCol());
                if (pattern.isHeaderLike() && pattern.colCount >= MIN_HEADER_COLUMNS
                        && looksLikeNewHeaderBlock(grid, row, bounds)) {
                    break;
                }
                lastDataRow = row;
            } else {
                int nextDataRow = TableRegionDetectionUtils.findNextDataRow(grid, row + 1, bounds);
                if (nextDataRow > 0 && nextDataRow - row > MAX_INNER_GAP) {
                    break;
                }
            }
        }
        return lastDataRow;
    }

    private static boolean looksLikeNewHeaderBlock(Grid grid, int startRow, SheetBounds bounds) {
        int headerRows = 0;
        int lastRow = Math.min(startRow + NEW_BLOCK_LOOK_AHEAD - 1, bounds.getMaxRow());
        for (int row = startRow; row <= lastRow; row++) {
            if (RowContentPattern.of(grid, row, bounds.getMinCol(), bounds.getMaxCol()).isHeaderLike()) {
                ++headerRows;
            }
        }
        return headerRows >= MIN_HEADER_BLOCK_ROWS;
    }

}
