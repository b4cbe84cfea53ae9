package com.abcft.sheetextract.core.table;

import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Tables of one sheet, in detection order.
 */
public final class SheetTables {

    private final int sheetIndex;
    private final String sheetName;
    private final ImmutableList<Table> tables;
    private final Throwable error;

    SheetTables(int sheetIndex, String sheetName, List<Table> tables) {
        this(sheetIndex, sheetName, tables, null);
    }

    SheetTables(int sheetIndex, String sheetName, List<Table> tables, @Nullable Throwable error) {
        this.sheetIndex = sheetIndex;
        this.sheetName = sheetName;
        this.tables = ImmutableList.copyOf(tables);
        this.error = error;
    }

    public int getSheetIndex() {
        return sheetIndex;
    }

    public String getSheetName() {
        return sheetName;
    }

    public List<Table> getTables() {
        return tables;
    }

    /**
     * The error which failed this sheet, {@code null} if it succeeded.
     */
    @Nullable
    public Throwable getError() {
        return error;
    }

    public boolean hasError() {
        return error != null;
    }

    @Override
    public String toString() {
        return "SheetTables{" + sheetIndex + ":" + sheetName + ", tables=" + tables.size()
                + (error != null ? ", error=" + error : "") + '}';
    }

}
