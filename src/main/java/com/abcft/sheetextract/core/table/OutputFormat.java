package com.abcft.sheetextract.core.table;

/**
 * Shape of assembled tables.
 */
public enum OutputFormat {
    /**
     * Full per-cell maps, labels with the most granular header first.
     */
    VERBOSE,
    /**
     * Aggregated counts only, {@code " | "} joined labels and title detection.
     */
    COMPACT
}
