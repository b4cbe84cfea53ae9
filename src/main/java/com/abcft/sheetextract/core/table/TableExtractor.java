package com.abcft.sheetextract.core.table;

import com.abcft.sheetextract.core.Extractor;
import com.abcft.sheetextract.core.grid.Grid;
import com.abcft.sheetextract.core.table.detectors.TableRegionDetector;
import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Extracts table structure from sheets.
 *
 * <p>Per sheet: detect regions, then for each region resolve headers, build labels and assemble the
 * table. Sheets are independent, a workbook may be processed with several sheets at a time while the
 * result keeps workbook order.</p>
 */
public class TableExtractor implements Extractor<WorkbookData, TableExtractParameters, Table,
        TableExtractionResult, TableCallback> {

    static final Logger logger = LogManager.getLogger(TableExtractor.class);

    @Override
    public int getVersion() {
        return 100;
    }

    /**
     * Extract the tables of a single sheet.
     *
     * @param grid the sheet.
     * @param params the parameters.
     * @return tables in detection order, empty only for an empty sheet.
     */
    public List<Table> extract(Grid grid, TableExtractParameters params) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(params, "params");
        List<TableRegion> regions = TableRegionDetector.INSTANCE.detect(grid, params);
        TableAssembler assembler = TableAssembler.forFormat(params.outputFormat);
        List<Table> tables = new ArrayList<>(regions.size());
        for (int i = 0; i < regions.size(); i++) {
            Table table = assembler.assemble(grid, regions.get(i), i);
            if (params.debug) {
                logger.debug("Sheet {}: {}", grid.getSheetName(), table.toDocument());
            }
            tables.add(table);
        }
        return tables;
    }

    public List<Table> extract(SheetData sheet, TableExtractParameters params) {
        Objects.requireNonNull(sheet, "sheet");
        return extract(sheet.toGrid(), params);
    }

    @Override
    public TableExtractionResult process(WorkbookData workbook, TableExtractParameters params, TableCallback callback) {
        Objects.requireNonNull(workbook, "workbook");
        Objects.requireNonNull(params, "params");
        Stopwatch stopwatch = Stopwatch.createStarted();
        TableExtractionResult result = new TableExtractionResult();
        if (callback != null) {
            callback.onStart(workbook);
        }
        List<SheetData> sheets = workbook.getSheets();
        ExecutorService executor = createExecutor(params, sheets.size());
        try {
            List<Future<List<Table>>> futures = new ArrayList<>(sheets.size());
            for (SheetData sheet : sheets) {
                futures.add(executor.submit(() -> extract(sheet, params)));
            }
            for (int i = 0; i < sheets.size(); i++) {
                String sheetName = sheets.get(i).getName();
                try {
                    List<Table> tables = futures.get(i).get();
                    result.addSheet(new SheetTables(i, sheetName, tables));
                    if (callback != null) {
                        tables.forEach(callback::onItemExtracted);
                    }
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    logger.warn(String.format("Error handling sheet #%d (%s) of %s", i, sheetName, describe(workbook, params)), cause);
                    result.recordError(cause);
                    result.addSheet(new SheetTables(i, sheetName, new ArrayList<>(), cause));
                    if (callback != null) {
                        callback.onExtractionError(cause);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.error("Interrupted while extracting " + describe(workbook, params), e);
                    result.recordError(e);
                    if (callback != null) {
                        callback.onExtractionError(e);
                    }
                    break;
                }
            }
        } finally {
            executor.shutdownNow();
        }
        result.setExtractDuration(stopwatch.elapsed(TimeUnit.MILLISECONDS));
        logger.info("{}: {} tables from {} sheets in {} ms, {} errors", describe(workbook, params),
                result.getItems().size(), sheets.size(), result.getExtractDuration(), result.getErrorCount());
        if (callback != null) {
            callback.onFinished(result);
        }
        return result;
    }

    private static ExecutorService createExecutor(TableExtractParameters params, int sheetCount) {
        int threads = Math.min(params.parallelism, sheetCount);
        if (threads <= 1) {
            return MoreExecutors.newDirectExecutorService();
        }
        return Executors.newFixedThreadPool(threads, new ThreadFactoryBuilder()
                .setNameFormat("sheet-extract-%d")
                .setDaemon(true)
                .build());
    }

    private static String describe(WorkbookData workbook, TableExtractParameters params) {
        return params.source != null ? params.source : workbook.getName();
    }

}
