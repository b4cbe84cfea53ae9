package com.abcft.sheetextract.core.table;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Sheets of a workbook, in workbook order.
 */
public final class WorkbookData {

    private final String name;
    private final ImmutableList<SheetData> sheets;

    public WorkbookData(String name, List<SheetData> sheets) {
        this.name = name;
        this.sheets = ImmutableList.copyOf(sheets);
    }

    public String getName() {
        return name;
    }

    public List<SheetData> getSheets() {
        return sheets;
    }

}
