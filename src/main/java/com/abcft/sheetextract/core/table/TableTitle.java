package com.abcft.sheetextract.core.table;

import com.abcft.sheetextract.core.grid.Cell;
import com.abcft.sheetextract.core.grid.Grid;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Represents a table title: a lone text cell right above a table, or on its first row.
 */
public final class TableTitle {

    private static final int MIN_TITLE_LENGTH = 3;
    private static final int MAX_TITLE_LENGTH = 100;

    /**
     * Texts matching any of these are data, not titles.
     */
    static final List<Pattern> FILTERED_PATTERNS = ImmutableList.of(
            // 纯数字或标点
            Pattern.compile("^[\\p{Punct}\\d\\s]+$"),
            // 年份
            Pattern.compile("\\b(19|20)\\d{2}\\b"),
            // 月份缩写
            Pattern.compile("\\b(jan|feb|mar|apr|may|jun|jul|aug|sep|sept|oct|nov|dec)\\b", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern HAS_LETTER = Pattern.compile("\\p{L}");

    private final String text;
    private final int row;

    private TableTitle(String text, int row) {
        this.text = text;
        this.row = row;
    }

    public String getText() {
        return text;
    }

    public int getRow() {
        return row;
    }

    /**
     * Whether this title sits on the first row of the region, which then no longer belongs to the table.
     */
    public boolean isInside(TableRegion region) {
        return row == region.getStartRow();
    }

    /**
     * Look for the title of a region, first on the row above it, then on its first row.
     * The first row is only considered when the region has more rows.
     *
     * @return the title, or {@code null} if none.
     */
    @Nullable
    public static TableTitle findTitle(Grid grid, TableRegion region) {
        if (region.isEmpty()) {
            return null;
        }
        int above = region.getStartRow() - 1;
        if (above >= 1) {
            TableTitle title = findTitleOnRow(grid, region, above);
            if (title != null) {
                return title;
            }
        }
        if (region.getRowCount() > 1) {
            return findTitleOnRow(grid, region, region.getStartRow());
        }
        return null;
    }

    @Nullable
    private static TableTitle findTitleOnRow(Grid grid, TableRegion region, int row) {
        List<Cell> cells = grid.getRowCells(row, region.getStartCol(), region.getEndCol());
        if (cells.size() != 1) {
            return null;
        }
        Cell cell = cells.get(0);
        if (cell.getCol() != region.getStartCol() || !cell.isText()) {
            return null;
        }
        String text = cell.getText();
        return isTitleText(text) ? new TableTitle(text, row) : null;
    }

    static boolean isTitleText(String text) {
        if (StringUtils.isBlank(text)) {
            return false;
        }
        String trimmed = text.trim();
        if (trimmed.length() < MIN_TITLE_LENGTH || trimmed.length() > MAX_TITLE_LENGTH) {
            return false;
        }
        if (!HAS_LETTER.matcher(trimmed).find()) {
            return false;
        }
        for (Pattern pattern : FILTERED_PATTERNS) {
            if (pattern.matcher(trimmed).find()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "TableTitle{" + text + " @" + row + '}';
    }

}
