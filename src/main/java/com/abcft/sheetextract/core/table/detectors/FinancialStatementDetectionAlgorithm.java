package com.abcft.sheetextract.core.table.detectors;

import com.abcft.sheetextract.core.grid.Cell;
import com.abcft.sheetextract.core.grid.Grid;
import com.abcft.sheetextract.core.grid.SheetBounds;
import com.abcft.sheetextract.core.table.TableExtractParameters;
import com.abcft.sheetextract.core.table.TableRegion;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Financial statement layout: section headers like "Assets" or "Liabilities" alone in the label
 * column, followed by labelled data rows. The whole statement is one table.
 */
public final class FinancialStatementDetectionAlgorithm implements DetectionAlgorithm {

    private static final Logger logger = LogManager.getLogger(FinancialStatementDetectionAlgorithm.class);

    public static final String ALGORITHM_NAME = "financial_statement";

    static final FinancialStatementDetectionAlgorithm INSTANCE = new FinancialStatementDetectionAlgorithm();

    static final List<String> FINANCIAL_TERMS = ImmutableList.of(
            "assets", "liabilities", "equity", "revenue", "expenses", "income", "cash",
            "receivable", "payable", "inventory", "property", "debt", "retained", "earnings",
            "capital", "current", "non-current", "total");

    static final int MIN_SECTION_HEADERS = 2;
    static final int MIN_DATA_ROWS = 3;
    /**
     * Data rows have a label plus more than this number of other cells.
     */
    static final int DATA_ROW_MIN_OTHER_CELLS = 2;
    static final float MIN_FINANCIAL_TERM_RATIO = 0.6f;

    private FinancialStatementDetectionAlgorithm() {
    }

    @Override
    public List<TableRegion> detect(Grid grid, SheetBounds bounds, TableExtractParameters params) {
        List<Integer> dataRows = TableRegionDetectionUtils.findDataRows(grid, bounds);
        if (dataRows.isEmpty()) {
            return ImmutableList.of();
        }
        int labelCol = TableRegionDetectionUtils.findLabelColumn(grid, bounds);
        List<String> sectionHeaders = new ArrayList<>();
        int labelledRows = 0;
        for (int row : dataRows) {
            if (TableRegionDetectionUtils.isSectionHeaderRow(grid, row, bounds, labelCol)) {
                sectionHeaders.add(grid.getCell(row, labelCol).getText());
            } else if (isLabelledDataRow(grid, row, bounds, labelCol)) {
                ++labelledRows;
            }
        }
        if (sectionHeaders.size() < MIN_SECTION_HEADERS || labelledRows < MIN_DATA_ROWS) {
            return ImmutableList.of();
        }
        long financial = sectionHeaders.stream().filter(FinancialStatementDetectionAlgorithm::hasFinancialTerm).count();
        if (financial < MIN_FINANCIAL_TERM_RATIO * sectionHeaders.size()) {
            logger.debug("Sheet {}: {}/{} section headers look financial", grid.getSheetName(),
                    financial, sectionHeaders.size());
            return ImmutableList.of();
        }
        int startRow = dataRows.get(0);
        int endRow = dataRows.get(dataRows.size() - 1);
        return ImmutableList.of(TableRegionDetectionUtils.narrowColumns(grid, bounds, startRow, endRow,
                DetectionMethod.FINANCIAL_STATEMENT));
    }

    private static boolean isLabelledDataRow(Grid grid, int row, SheetBounds bounds, int labelCol) {
        Cell label = grid.getCell(row, labelCol);
        if (label == null || !label.isText() || label.isNumberLike()) {
            return false;
        }
        int others = grid.getRowCells(row, bounds.getMinCol(), bounds.getMaxCol()).size() - 1;
        return others > DATA_ROW_MIN_OTHER_CELLS;
    }

    static boolean hasFinancialTerm(String text) {
        String lower = StringUtils.lowerCase(text);
        for (String term : FINANCIAL_TERMS) {
            if (StringUtils.contains(lower, term)) {
                return true;
            }
        }
        return false;
    }

}
