package com.abcft.sheetextract.core.table;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TableExtractParametersTest {

    @Test
    void defaults() {
        TableExtractParameters params = TableExtractParameters.defaults();

        assertFalse(params.debug);
        assertFalse(params.useGaps);
        assertEquals(3, params.gapThreshold);
        assertEquals(2, params.compactGapThreshold);
        assertEquals(OutputFormat.VERBOSE, params.outputFormat);
        assertEquals(1, params.parallelism);
        assertEquals(3, params.effectiveGapThreshold());
    }

    @Test
    void fromMap() {
        Map<String, String> map = ImmutableMap.<String, String>builder()
                .put("debug", "yes")
                .put("source", "book.xlsx")
                .put("table_detection.use_gaps", "true")
                .put("table_detection.gap_threshold", "5")
                .put("table_detection.compact_gap_threshold", "4")
                .put("table.outputFormat", "compact")
                .put("table.parallelism", "4")
                .build();

        TableExtractParameters params = new TableExtractParameters.Builder(map).build();

        assertTrue(params.debug);
        assertEquals("book.xlsx", params.source);
        assertTrue(params.useGaps);
        assertEquals(5, params.gapThreshold);
        assertEquals(4, params.compactGapThreshold);
        assertEquals(OutputFormat.COMPACT, params.outputFormat);
        assertEquals(4, params.parallelism);
        assertEquals(4, params.effectiveGapThreshold());
    }

    @Test
    void invalidValuesFallBack() {
        Map<String, String> map = ImmutableMap.of(
                "table_detection.gap_threshold", "0",
                "table_detection.compact_gap_threshold", "many",
                "table.outputFormat", "fancy",
                "table.parallelism", "-2");

        TableExtractParameters params = new TableExtractParameters.Builder(map).build();

        assertEquals(TableExtractParameters.DEFAULT_GAP_THRESHOLD, params.gapThreshold);
        assertEquals(TableExtractParameters.DEFAULT_COMPACT_GAP_THRESHOLD, params.compactGapThreshold);
        assertEquals(OutputFormat.VERBOSE, params.outputFormat);
        assertEquals(1, params.parallelism);
    }

    @Test
    void buildUponKeepsValues() {
        TableExtractParameters params = new TableExtractParameters.Builder()
                .setUseGaps(true)
                .setGapThreshold(6)
                .setOutputFormat(OutputFormat.COMPACT)
                .setSource("a.xlsx")
                .build();

        TableExtractParameters copy = params.buildUpon().setParallelism(2).build();

        assertTrue(copy.useGaps);
        assertEquals(6, copy.gapThreshold);
        assertEquals(OutputFormat.COMPACT, copy.outputFormat);
        assertEquals("a.xlsx", copy.source);
        assertEquals(2, copy.parallelism);
        assertEquals(1, params.parallelism);
    }

}
