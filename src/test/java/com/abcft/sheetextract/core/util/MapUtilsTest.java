package com.abcft.sheetextract.core.util;

import com.abcft.sheetextract.core.table.OutputFormat;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MapUtilsTest {

    private final Map<String, String> params = ImmutableMap.<String, String>builder()
            .put("flag", "true")
            .put("off", "0")
            .put("bad", "maybe")
            .put("count", " 7 ")
            .put("nan", "seven")
            .put("format", "compact")
            .build();

    @Test
    void booleans() {
        assertTrue(MapUtils.getBoolean(params, "flag", false));
        assertFalse(MapUtils.getBoolean(params, "off", true));
        assertTrue(MapUtils.getBoolean(params, "bad", true));
        assertFalse(MapUtils.getBoolean(params, "missing", false));
        assertTrue(MapUtils.getBoolean(null, "flag", true));
    }

    @Test
    void ints() {
        assertEquals(7, MapUtils.getInt(params, "count", 1));
        assertEquals(1, MapUtils.getInt(params, "nan", 1));
        assertEquals(3, MapUtils.getInt(params, "missing", 3));
    }

    @Test
    void enums() {
        assertEquals(OutputFormat.COMPACT, MapUtils.getEnum(params, "format", OutputFormat.class, OutputFormat.VERBOSE));
        assertEquals(OutputFormat.VERBOSE, MapUtils.getEnum(params, "bad", OutputFormat.class, OutputFormat.VERBOSE));
    }

}
