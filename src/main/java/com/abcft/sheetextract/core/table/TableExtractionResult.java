package com.abcft.sheetextract.core.table;

import com.abcft.sheetextract.core.ExtractionResult;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of table extraction over a workbook.
 */
public class TableExtractionResult extends ExtractionResult<Table> {

    private final ArrayList<SheetTables> sheets = new ArrayList<>();
    private final ArrayList<Table> tables = new ArrayList<>();

    @Override
    public List<Table> getItems() {
        return Collections.unmodifiableList(tables);
    }

    @Override
    public boolean hasResult() {
        return !tables.isEmpty();
    }

    public List<SheetTables> getSheets() {
        return Collections.unmodifiableList(sheets);
    }

    @Nullable
    public SheetTables getSheet(String sheetName) {
        for (SheetTables sheet : sheets) {
            if (sheet.getSheetName().equals(sheetName)) {
                return sheet;
            }
        }
        return null;
    }

    public List<Table> getItemsBySheet(String sheetName) {
        SheetTables sheet = getSheet(sheetName);
        return sheet != null ? sheet.getTables() : Collections.emptyList();
    }

    void addSheet(SheetTables sheet) {
        sheets.add(sheet);
        tables.addAll(sheet.getTables());
    }

}
