package com.abcft.sheetextract.core.util;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.math3.util.FastMath;

import java.math.BigDecimal;
import java.text.SimpleDateFormat;
import java.time.temporal.TemporalAccessor;
import java.util.Calendar;
import java.util.Date;

/**
 * Utility methods for number and value handling.
 */
public final class NumberUtil {

    private NumberUtil() {
    }

    /**
     * Check if a string reads as a number once common formatting ({@code , $ %} and spaces) is removed.
     */
    public static boolean isNumericString(String value) {
        if (StringUtils.isBlank(value)) {
            return false;
        }
        String cleaned = StringUtils.remove(StringUtils.deleteWhitespace(value), ',');
        cleaned = StringUtils.remove(cleaned, '$');
        cleaned = StringUtils.remove(cleaned, '%');
        if (cleaned.isEmpty()) {
            return false;
        }
        // Java 会接受 "1d", "1f" 这样的后缀
        char last = cleaned.charAt(cleaned.length() - 1);
        if (!Character.isDigit(last) && last != '.') {
            return false;
        }
        try {
            double d = Double.parseDouble(cleaned);
            return !Double.isNaN(d) && !Double.isInfinite(d);
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * Check if a string only has digits once dots and dashes are removed, like {@code 12.5} or {@code 2023-01}.
     */
    public static boolean isDigitString(String value) {
        if (value == null) {
            return false;
        }
        String cleaned = StringUtils.remove(StringUtils.remove(value, '.'), '-');
        return !cleaned.isEmpty() && StringUtils.isNumeric(cleaned);
    }

    /**
     * Number or a digit string, the loose test used for row content patterns.
     */
    public static boolean isLooseNumeric(Object value) {
        return value instanceof Number || (value instanceof String && isDigitString((String) value));
    }

    public static boolean isTemporalValue(Object value) {
        return value instanceof Date || value instanceof Calendar || value instanceof TemporalAccessor;
    }

    /**
     * Render a cell value as label text.
     *
     * Integral floating point numbers lose their fraction, dates use ISO format.
     */
    public static String formatValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String) {
            return ((String) value).trim();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (!Double.isInfinite(d) && d == FastMath.rint(d) && FastMath.abs(d) < 1e15) {
                return String.valueOf((long) d);
            }
            return String.valueOf(d);
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).stripTrailingZeros().toPlainString();
        }
        if (value instanceof Date) {
            return new SimpleDateFormat("yyyy-MM-dd").format((Date) value);
        }
        if (value instanceof Calendar) {
            return new SimpleDateFormat("yyyy-MM-dd").format(((Calendar) value).getTime());
        }
        return String.valueOf(value);
    }

}
