package com.abcft.sheetextract.core.grid;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A row of the compact input: row number plus cell tuples.
 *
 * <p>Each tuple is {@code [col, value, ...]}. A tuple of at least five elements whose last element
 * is an integer greater than one is a run of that many columns starting at {@code col}.</p>
 */
public final class CompactRow {

    private final int r;
    private final List<List<Object>> cells;

    public CompactRow(int r, List<List<Object>> cells) {
        this.r = r;
        this.cells = cells == null ? ImmutableList.of() : new ArrayList<>(cells);
    }

    public static CompactRow of(int r, Object[]... tuples) {
        List<List<Object>> cells = new ArrayList<>(tuples.length);
        for (Object[] tuple : tuples) {
            cells.add(tuple == null ? null : Arrays.asList(tuple));
        }
        return new CompactRow(r, cells);
    }

    public int getR() {
        return r;
    }

    public List<List<Object>> getCells() {
        return cells;
    }

}
