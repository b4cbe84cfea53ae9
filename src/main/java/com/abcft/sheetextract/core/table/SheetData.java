package com.abcft.sheetextract.core.table;

import com.abcft.sheetextract.core.grid.*;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Raw cells of one sheet as handed over by the cell extractor, in either the coordinate keyed
 * or the compact row layout.
 */
public final class SheetData {

    public static final class Builder {

        private final String name;
        private Map<String, CellRecord> cells;
        private List<CompactRow> rows;
        private SheetBounds bounds;
        private List<? extends Number> dimensions;
        private FrozenPanes frozenPanes = FrozenPanes.NONE;

        public Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder setCells(Map<String, CellRecord> cells) {
            this.cells = cells;
            this.rows = null;
            return this;
        }

        public Builder setCompactRows(List<CompactRow> rows) {
            this.rows = rows;
            this.cells = null;
            return this;
        }

        public Builder setBounds(@Nullable SheetBounds bounds) {
            this.bounds = bounds;
            this.dimensions = null;
            return this;
        }

        /**
         * Set dimensions as {@code [min_row, min_col, max_row, max_col]}, checked when the grid is built.
         */
        public Builder setDimensions(@Nullable List<? extends Number> dimensions) {
            this.dimensions = dimensions;
            this.bounds = null;
            return this;
        }

        public Builder setFrozenPanes(@Nullable FrozenPanes frozenPanes) {
            this.frozenPanes = frozenPanes != null ? frozenPanes : FrozenPanes.NONE;
            return this;
        }

        /**
         * Set the raw frozen hint, see {@link FrozenPanes#parse(Object)}.
         */
        public Builder setFrozenHint(@Nullable Object hint) {
            this.frozenPanes = FrozenPanes.parse(hint);
            return this;
        }

        public SheetData build() {
            return new SheetData(this);
        }
    }

    private final String name;
    private final Map<String, CellRecord> cells;
    private final List<CompactRow> rows;
    private final SheetBounds bounds;
    private final List<? extends Number> dimensions;
    private final FrozenPanes frozenPanes;

    private SheetData(Builder builder) {
        this.name = builder.name;
        this.cells = builder.cells;
        this.rows = builder.rows;
        this.bounds = builder.bounds;
        this.dimensions = builder.dimensions;
        this.frozenPanes = builder.frozenPanes;
    }

    public String getName() {
        return name;
    }

    public boolean isCompact() {
        return rows != null;
    }

    /**
     * Bounds supplied by the caller, {@code null} if they are computed from the cells.
     *
     * @throws com.abcft.sheetextract.core.MalformedGridException if the bounds are inconsistent.
     */
    @Nullable
    public SheetBounds getBounds() {
        if (bounds == null && dimensions != null) {
            return SheetBounds.fromDimensions(dimensions);
        }
        return bounds;
    }

    public FrozenPanes getFrozenPanes() {
        return frozenPanes;
    }

    /**
     * Normalize into a grid.
     *
     * @throws com.abcft.sheetextract.core.MalformedGridException if the bounds are inconsistent.
     */
    public Grid toGrid() {
        SheetBounds sheetBounds = getBounds();
        if (rows != null) {
            return GridNormalizer.fromCompactRows(name, rows, sheetBounds, frozenPanes);
        }
        return GridNormalizer.fromCellMap(name, cells, sheetBounds, frozenPanes);
    }

}
