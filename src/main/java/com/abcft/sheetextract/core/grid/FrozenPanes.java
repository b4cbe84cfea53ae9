package com.abcft.sheetextract.core.grid;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Frozen pane hint of a sheet, number of leading rows/columns kept fixed.
 */
public final class FrozenPanes {

    private static final Logger logger = LogManager.getLogger(FrozenPanes.class);

    public static final FrozenPanes NONE = new FrozenPanes(0, 0);

    private final int frozenRows;
    private final int frozenCols;

    public static FrozenPanes of(int frozenRows, int frozenCols) {
        if (frozenRows <= 0 && frozenCols <= 0) {
            return NONE;
        }
        return new FrozenPanes(frozenRows, frozenCols);
    }

    /**
     * Parse the hint carried by sheet data.
     *
     * Accepts either a map with {@code frozen_rows}/{@code frozen_cols} or a list {@code [rows, cols]}.
     * Anything else yields {@link #NONE}.
     *
     * @param hint the raw hint, might be {@code null}.
     * @return the parsed frozen panes.
     */
    public static FrozenPanes parse(Object hint) {
        if (hint instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) hint;
            return of(toInt(map.get("frozen_rows")), toInt(map.get("frozen_cols")));
        } else if (hint instanceof List) {
            List<?> list = (List<?>) hint;
            if (list.size() >= 2) {
                return of(toInt(list.get(0)), toInt(list.get(1)));
            }
        } else if (hint != null) {
            logger.debug("Unsupported frozen panes hint: {}", hint);
        }
        return NONE;
    }

    private static int toInt(Object value) {
        if (value instanceof Number) {
            return Math.max(((Number) value).intValue(), 0);
        }
        if (value instanceof String) {
            try {
                return Math.max(Integer.parseInt(((String) value).trim()), 0);
            } catch (NumberFormatException e) {
                logger.debug("Invalid frozen panes count: {}", value);
            }
        }
        return 0;
    }

    private FrozenPanes(int frozenRows, int frozenCols) {
        this.frozenRows = Math.max(frozenRows, 0);
        this.frozenCols = Math.max(frozenCols, 0);
    }

    public int getFrozenRows() {
        return frozenRows;
    }

    public int getFrozenCols() {
        return frozenCols;
    }

    public boolean isFrozen() {
        return frozenRows > 0 || frozenCols > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FrozenPanes that = (FrozenPanes) o;
        return frozenRows == that.frozenRows && frozenCols == that.frozenCols;
    }

    @Override
    public int hashCode() {
        return Objects.hash(frozenRows, frozenCols);
    }

    @Override
    public String toString() {
        return "FrozenPanes{rows=" + frozenRows + ", cols=" + frozenCols + '}';
    }

}
