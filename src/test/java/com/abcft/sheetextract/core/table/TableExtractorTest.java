package com.abcft.sheetextract.core.table;

import com.abcft.sheetextract.core.MalformedGridException;
import com.abcft.sheetextract.core.grid.FrozenPanes;
import com.abcft.sheetextract.core.grid.Grid;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.abcft.sheetextract.core.grid.GridFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class TableExtractorTest {

    private final TableExtractor extractor = new TableExtractor();
    private final TableExtractParameters verbose = TableExtractParameters.defaults();
    private final TableExtractParameters compact = new TableExtractParameters.Builder()
            .setOutputFormat(OutputFormat.COMPACT).build();

    @Test
    void verboseTable() {
        Grid grid = grid(
                row("Product", "Jan", "Feb"),
                row("Widget A", 100, 120));

        List<Table> tables = extractor.extract(grid, verbose);

        assertEquals(1, tables.size());
        Table table = tables.get(0);
        assertEquals("table_1", table.getId());
        assertEquals("Table 1", table.getName());
        assertEquals("Sheet1", table.getSheetName());
        assertNull(table.getTitle());
        assertEquals("default", table.getDetectionMethod());
        assertEquals(Collections.singletonList(1), table.getHeaderInfo().getHeaderRows());
        assertEquals(Collections.singletonList(1), table.getHeaderInfo().getHeaderColumns());

        assertEquals("Product", table.getColumn(1).getLabel());
        assertEquals("Jan", table.getColumn(2).getLabel());
        assertEquals("Feb", table.getColumn(3).getLabel());
        assertTrue(table.getColumn(1).isHeader());
        assertEquals("B", table.getColumn(2).getLetter());
        assertEquals("Jan", table.getColumn(2).getCells().get("B1"));
        assertEquals(100, table.getColumn(2).getCells().get("B2"));

        assertEquals("Product", table.getRow(1).getLabel());
        assertTrue(table.getRow(1).isHeader());
        assertEquals("Widget A", table.getRow(2).getLabel());
        assertEquals(3, table.getRow(2).getCellCount());

        assertEquals(6, table.getMetadata().getCellCount());
        assertEquals(2, table.getMetadata().getNumericCellCount());
    }

    @Test
    void verboseFrozenYearMonthHeaders() {
        Grid grid = grid(FrozenPanes.of(2, 0),
                row("2023", "2023", "2023"),
                row("Jan", "Feb", "Mar"),
                row(10, 20, 30));

        Table table = extractor.extract(grid, verbose).get(0);

        assertEquals("frozen_panes", table.getDetectionMethod());
        assertEquals("Feb 2023", table.getColumn(2).getLabel());
        assertEquals("Jan 2023", table.getRow(3).getLabel());
    }

    @Test
    void extractionIsDeterministic() {
        Grid grid = grid(
                row("Name", "Q1", "Q2"),
                row("Alpha", 1, 2),
                row("Beta", 3, 4),
                blank(), blank(), blank(), blank(),
                row(null, "Item", "Cost", "Qty"),
                row(null, "Bolt", 5, 6),
                row(null, "Nut", 7, 8));

        List<Table> first = extractor.extract(grid, verbose);
        List<Table> second = extractor.extract(grid, verbose);

        assertEquals(2, first.size());
        assertEquals(first, second);
        assertEquals("table_2", first.get(1).getId());
        assertEquals("B8:D10", first.get(1).getRegion().formatAsString());
    }

    @Test
    void compactTitleLeavesTable() {
        Grid grid = grid(
                row("Quarterly Sales"),
                row("Product", "Units", "Price"),
                row("Bolt", 5, 6),
                row("Nut", 7, 8),
                blank(), blank(), blank(), blank(),
                row("Inventory Status"),
                row("Item", "Stock", "Bin"),
                row("Washer", 3, 4),
                row("Screw", 1, 2));

        List<Table> tables = extractor.extract(grid, compact);

        assertEquals(2, tables.size());
        Table table = tables.get(0);
        assertEquals("t1", table.getId());
        assertEquals("blank_row_separation", table.getDetectionMethod());
        assertEquals("Quarterly Sales", table.getTitle());
        assertEquals(2, table.getRegion().getStartRow());
        assertEquals(4, table.getRegion().getEndRow());
        assertEquals(Collections.singletonList(2), table.getHeaderInfo().getHeaderRows());
        assertEquals(9, table.getMetadata().getCellCount());
        assertEquals(4, table.getMetadata().getNumericCellCount());
        assertEquals("Units", table.getColumn(2).getLabel());
        assertEquals(2, table.getRows().size());
        assertEquals("Bolt", table.getRow(3).getLabel());
        assertEquals("Nut", table.getRow(4).getLabel());
        assertTrue(table.getColumn(2).getCells().isEmpty());
        assertEquals(3, table.getColumn(2).getCellCount());

        Table second = tables.get(1);
        assertEquals("t2", second.getId());
        assertEquals("Inventory Status", second.getTitle());
        assertEquals(10, second.getRegion().getStartRow());
        assertEquals("Stock", second.getColumn(2).getLabel());
    }

    @Test
    void titleAboveRegionBelongsToPreviousTable() {
        // 标题行单独成表，下一个表格把它当作标题
        Grid grid = grid(
                row("Quarterly Sales"),
                row("Product", "Units", "Price"),
                row("Bolt", 5, 6),
                row("Nut", 7, 8));

        List<Table> tables = extractor.extract(grid, compact);

        assertEquals(2, tables.size());
        Table titleOnly = tables.get(0);
        assertEquals("column_continuity", titleOnly.getDetectionMethod());
        assertNull(titleOnly.getTitle());
        assertEquals(1, titleOnly.getRegion().getStartRow());
        assertEquals(1, titleOnly.getRegion().getEndRow());

        Table table = tables.get(1);
        assertEquals("Quarterly Sales", table.getTitle());
        assertEquals(2, table.getRegion().getStartRow());
        assertEquals(4, table.getRegion().getEndRow());
        assertEquals(Collections.singletonList(2), table.getHeaderInfo().getHeaderRows());
        assertEquals("Product", table.getColumn(1).getLabel());
        assertEquals(Arrays.asList(3, 4), rowIndices(table));
    }

    @Test
    void compactTitleOnFrozenRowStaysHeader() {
        Grid grid = grid(FrozenPanes.of(2, 0),
                row("Sales Report"),
                row("Product", "Jan", "Feb"),
                row("Widget A", 100, 120),
                row("Widget B", 90, 80));

        Table table = extractor.extract(grid, compact).get(0);

        assertEquals("frozen_panes", table.getDetectionMethod());
        assertEquals("Sales Report", table.getTitle());
        assertEquals(1, table.getRegion().getStartRow());
        assertEquals(Arrays.asList(1, 2), table.getHeaderInfo().getHeaderRows());
        assertEquals(3, table.getHeaderInfo().getDataStartRow());
        assertEquals("Jan", table.getColumn(2).getLabel());
        assertEquals("Feb", table.getColumn(3).getLabel());
        assertEquals(Arrays.asList(3, 4), rowIndices(table));
        assertEquals("Widget A", table.getRow(3).getLabel());
        assertEquals("Widget B", table.getRow(4).getLabel());
        assertEquals(10, table.getMetadata().getCellCount());
        assertEquals(4, table.getMetadata().getNumericCellCount());
    }

    @Test
    void verboseHeaderContexts() {
        Grid grid = grid(
                row("Product", "Jan", "Feb"),
                row("Widget A", 100, 120));

        Table table = extractor.extract(grid, verbose).get(0);

        assertEquals(2, table.getHeaderContexts().size());
        HeaderContext context = table.getHeaderContext("B2");
        assertNotNull(context);
        assertEquals(Collections.singletonList("Jan"), context.getFullColumnPath());
        assertEquals(Collections.singletonList("Widget A"), context.getFullRowPath());
        assertNull(table.getHeaderContext("A2"));
        assertNull(table.getHeaderContext("B1"));

        JsonObject doc = table.toDocument(true).getAsJsonObject("header_context").getAsJsonObject("C2");
        assertEquals("Feb", doc.getAsJsonObject("header_summary").get("primary_column_header").getAsString());
        assertEquals("Widget A", doc.getAsJsonArray("full_row_path").get(0).getAsString());

        Table compactTable = extractor.extract(grid, compact).get(0);
        assertTrue(compactTable.getHeaderContexts().isEmpty());
    }

    private static List<Integer> rowIndices(Table table) {
        List<Integer> indices = new ArrayList<>();
        table.getRows().forEach(r -> indices.add(r.getIndex()));
        return indices;
    }

    @Test
    void compactRunsCountPerCoveredColumn() {
        Grid grid = compactGrid(FrozenPanes.NONE,
                compactRow(1, tuple(1, "Item"), tuple(2, "Jan"), tuple(3, "Feb"), tuple(4, "Mar")),
                compactRow(2, tuple(1, "Bolt"), run(2, 5, 3)),
                compactRow(3, tuple(1, "Nut"), run(2, 7, 3)));

        Table table = extractor.extract(grid, compact).get(0);

        assertEquals("content_structure", table.getDetectionMethod());
        assertEquals(12, table.getMetadata().getCellCount());
        assertEquals(6, table.getMetadata().getNumericCellCount());
        assertEquals(7, table.getColumn(2).getCellCount());
        assertEquals(1, table.getColumn(3).getCellCount());
        assertEquals(4, table.getRow(2).getCellCount());
    }

    @Test
    void compactFrozenHeadersJoinedTopDown() {
        Grid grid = grid(FrozenPanes.of(2, 0),
                row("2023", "2023", "2023"),
                row("Jan", "Feb", "Mar"),
                row(10, 20, 30));

        Table table = extractor.extract(grid, compact).get(0);

        assertEquals("2023 | Jan", table.getColumn(1).getLabel());
        assertEquals("2023 | Mar", table.getColumn(3).getLabel());
    }

    @Test
    void emptySheetHasNoTable() {
        assertTrue(extractor.extract(grid(), verbose).isEmpty());
    }

    @Test
    void nullGridRejected() {
        assertThrows(NullPointerException.class, () -> extractor.extract((Grid) null, verbose));
    }

    @Test
    void document() {
        Grid grid = grid(
                row("Product", "Jan", "Feb"),
                row("Widget A", 100, 120));
        Table table = extractor.extract(grid, verbose).get(0);

        JsonObject summary = table.toDocument();
        JsonObject detail = table.toDocument(true);

        assertEquals("table_1", summary.get("id").getAsString());
        assertEquals("A1:C2", summary.getAsJsonObject("region").get("ref").getAsString());
        assertEquals("default", summary.getAsJsonObject("meta").get("method").getAsString());
        assertEquals("Jan", summary.getAsJsonObject("labels").getAsJsonArray("cols").get(1).getAsString());
        assertEquals(120, detail.getAsJsonObject("cells").get("C2").getAsInt());
    }

    private static SheetData sheet(String name, Object[]... rows) {
        return new SheetData.Builder(name).setCells(cells(rows)).build();
    }

    private static WorkbookData workbook() {
        List<SheetData> sheets = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            sheets.add(sheet("S" + i,
                    row("Product", "Jan", "Feb"),
                    row("Widget " + i, i, i + 1)));
        }
        sheets.add(2, new SheetData.Builder("Broken")
                .setCells(cells(row("a", 1)))
                .setDimensions(Arrays.asList(5, 1, 1, 1))
                .build());
        return new WorkbookData("book", sheets);
    }

    @Test
    void workbookKeepsSheetOrder() {
        TableExtractParameters params = new TableExtractParameters.Builder().setParallelism(3).build();

        TableExtractionResult result = extractor.process(workbook(), params, null);

        List<String> names = new ArrayList<>();
        result.getSheets().forEach(s -> names.add(s.getSheetName()));
        assertEquals(Arrays.asList("S1", "S2", "Broken", "S3", "S4", "S5"), names);
        assertEquals(5, result.getItems().size());
        assertEquals("Widget 4", result.getItemsBySheet("S4").get(0).getRow(2).getLabel());
        assertTrue(result.hasResult());
        assertTrue(result.getExtractDuration() >= 0);
    }

    @Test
    void brokenSheetIsIsolated() {
        TableExtractionResult result = extractor.process(workbook(), verbose, null);

        SheetTables broken = result.getSheet("Broken");
        assertNotNull(broken);
        assertTrue(broken.hasError());
        assertInstanceOf(MalformedGridException.class, broken.getError());
        assertTrue(broken.getTables().isEmpty());
        assertEquals(1, result.getErrorCount());
        assertFalse(result.getSheet("S3").hasError());
        assertEquals(1, result.getSheet("S3").getTables().size());
    }

    @Test
    void parallelMatchesSequential() {
        TableExtractParameters parallel = new TableExtractParameters.Builder().setParallelism(4).build();

        TableExtractionResult sequential = extractor.process(workbook(), verbose, null);
        TableExtractionResult concurrent = extractor.process(workbook(), parallel, null);

        assertEquals(sequential.getItems(), concurrent.getItems());
    }

    @Test
    void callbackEvents() {
        List<String> events = Collections.synchronizedList(new ArrayList<>());
        TableCallback callback = new TableCallback() {
            @Override
            public void onStart(Object document) {
                events.add("start");
            }

            @Override
            public void onItemExtracted(Table item) {
                events.add("table " + item.getSheetName());
            }

            @Override
            public void onExtractionError(Throwable e) {
                events.add("error");
            }

            @Override
            public void onFinished(TableExtractionResult result) {
                events.add("finished " + result.getItems().size());
            }
        };

        extractor.process(workbook(), verbose, callback);

        assertEquals(Arrays.asList("start", "table S1", "table S2", "error", "table S3", "table S4", "table S5",
                "finished 5"), events);
    }

}
