package com.abcft.sheetextract.core.util;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;

/**
 * Helpers to read typed values from flat string parameter maps.
 *
 * Unparseable or missing values fall back to the supplied default.
 */
public final class MapUtils {

    private static final Logger logger = LogManager.getLogger(MapUtils.class);

    private MapUtils() {
    }

    public static String getString(Map<String, String> params, String key, String defaultValue) {
        if (params == null) {
            return defaultValue;
        }
        String value = params.get(key);
        return StringUtils.isBlank(value) ? defaultValue : value.trim();
    }

    public static boolean getBoolean(Map<String, String> params, String key, boolean defaultValue) {
        String value = getString(params, key, null);
        if (null == value) {
            return defaultValue;
        }
        if ("true".equalsIgnoreCase(value) || "1".equals(value) || "yes".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value) || "0".equals(value) || "no".equalsIgnoreCase(value)) {
            return false;
        }
        logger.warn("Invalid boolean value for {}: {}, using {}", key, value, defaultValue);
        return defaultValue;
    }

    public static int getInt(Map<String, String> params, String key, int defaultValue) {
        String value = getString(params, key, null);
        if (null == value) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            logger.warn("Invalid int value for {}: {}, using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public static <E extends Enum<E>> E getEnum(Map<String, String> params, String key, Class<E> clazz, E defaultValue) {
        String value = getString(params, key, null);
        if (null == value) {
            return defaultValue;
        }
        for (E e : clazz.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(value)) {
                return e;
            }
        }
        logger.warn("Invalid {} value for {}: {}, using {}", clazz.getSimpleName(), key, value, defaultValue);
        return defaultValue;
    }

}
