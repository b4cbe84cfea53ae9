package com.abcft.sheetextract.core.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class NumberUtilTest {

    @Test
    void numericStrings() {
        assertTrue(NumberUtil.isNumericString("1,234.5"));
        assertTrue(NumberUtil.isNumericString("$ 12"));
        assertTrue(NumberUtil.isNumericString("-3%"));
        assertFalse(NumberUtil.isNumericString("1d"));
        assertFalse(NumberUtil.isNumericString("NaN"));
        assertFalse(NumberUtil.isNumericString("abc"));
        assertFalse(NumberUtil.isNumericString("  "));
    }

    @Test
    void digitStrings() {
        assertTrue(NumberUtil.isDigitString("2023-01"));
        assertTrue(NumberUtil.isDigitString("12.5"));
        assertFalse(NumberUtil.isDigitString("1,000"));
        assertFalse(NumberUtil.isDigitString("--"));
    }

    @Test
    void formatValues() {
        assertEquals("2023", NumberUtil.formatValue(2023.0));
        assertEquals("1.5", NumberUtil.formatValue(1.5));
        assertEquals("10", NumberUtil.formatValue(10));
        assertEquals("1.2", NumberUtil.formatValue(new BigDecimal("1.20")));
        assertEquals("2024-01-31", NumberUtil.formatValue(LocalDate.of(2024, 1, 31)));
        assertEquals("Jan", NumberUtil.formatValue(" Jan "));
        assertEquals("true", NumberUtil.formatValue(true));
        assertEquals("", NumberUtil.formatValue(null));
    }

}
