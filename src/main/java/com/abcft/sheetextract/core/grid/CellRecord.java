package com.abcft.sheetextract.core.grid;

import javax.annotation.Nullable;

/**
 * A cell record of the coordinate keyed input, as delivered by the cell extractor.
 *
 * Row and column are optional, the coordinate key is used when they are absent.
 */
public final class CellRecord {

    private final Object value;
    private final Integer row;
    private final Integer column;

    public CellRecord(@Nullable Object value) {
        this(value, null, null);
    }

    public CellRecord(@Nullable Object value, @Nullable Integer row, @Nullable Integer column) {
        this.value = value;
        this.row = row;
        this.column = column;
    }

    @Nullable
    public Object getValue() {
        return value;
    }

    @Nullable
    public Integer getRow() {
        return row;
    }

    @Nullable
    public Integer getColumn() {
        return column;
    }

}
