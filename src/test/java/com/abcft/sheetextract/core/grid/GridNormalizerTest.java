package com.abcft.sheetextract.core.grid;

import com.abcft.sheetextract.core.MalformedGridException;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.abcft.sheetextract.core.grid.GridFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class GridNormalizerTest {

    @Test
    void coordinateMapUsesCoordinateWhenRowAndColumnAreMissing() {
        Map<String, CellRecord> cells = new HashMap<>();
        cells.put("B7", new CellRecord("x"));
        cells.put("AA3", new CellRecord(12));
        cells.put("C1", new CellRecord("y", 2, 4));

        Grid grid = GridNormalizer.fromCellMap("s", cells, null, null);

        assertEquals("x", grid.getValue(7, 2));
        assertEquals(12, grid.getValue(3, 27));
        assertEquals("y", grid.getValue(2, 4));
        assertNull(grid.getValue(1, 3));
        assertEquals(SheetBounds.of(2, 2, 7, 27), grid.getBounds());
        assertEquals(FrozenPanes.NONE, grid.getFrozenPanes());
    }

    @Test
    void keepsZeroAndFalseButDropsNullAndBlankStrings() {
        Map<String, CellRecord> cells = new HashMap<>();
        cells.put("A1", new CellRecord(0));
        cells.put("A2", new CellRecord(Boolean.FALSE));
        cells.put("A3", new CellRecord(null));
        cells.put("A4", new CellRecord("   "));
        cells.put("A5", new CellRecord(""));
        cells.put("A6", new CellRecord(" ok "));

        Grid grid = GridNormalizer.fromCellMap("s", cells, null, null);

        assertEquals(3, grid.size());
        assertTrue(grid.hasCell(1, 1));
        assertTrue(grid.hasCell(2, 1));
        assertFalse(grid.hasCell(3, 1));
        assertFalse(grid.hasCell(4, 1));
        assertFalse(grid.hasCell(5, 1));
        assertEquals("ok", grid.getCell(6, 1).getText());
    }

    @Test
    void skipsInvalidCoordinates() {
        Map<String, CellRecord> cells = new HashMap<>();
        cells.put("A1", new CellRecord("ok"));
        cells.put("", new CellRecord("no"));

        Grid grid = GridNormalizer.fromCellMap("s", cells, null, null);

        assertEquals(1, grid.size());
    }

    @Test
    void compactRunsArePresentAtTheirStartOnly() {
        Grid grid = compactGrid(FrozenPanes.NONE,
                compactRow(1, tuple(1, "Item"), run(2, 5, 3)),
                compactRow(2, tuple(1, "Nut"), tuple(2, 1)));

        Cell run = grid.getCell(1, 2);
        assertNotNull(run);
        assertTrue(run.isRun());
        assertEquals(3, run.getRunLength());
        assertEquals(4, run.getLastCol());
        assertFalse(grid.hasCell(1, 3));
        assertFalse(grid.hasCell(1, 4));
        // 由 run 的最后一列决定边界
        assertEquals(SheetBounds.of(1, 1, 2, 4), grid.getBounds());
    }

    @Test
    void countingMultipliesRunsAndIgnoresBooleans() {
        Grid grid = compactGrid(FrozenPanes.NONE,
                compactRow(1, tuple(1, "Item"), run(2, 5, 3)),
                compactRow(2, tuple(1, true), run(2, "n/a", 4)),
                compactRow(3, tuple(1, 2.5), tuple(2, 0)));

        assertEquals(1 + 3 + 1 + 4 + 2, grid.countCells(1, 3, 1, 10));
        assertEquals(3 + 2, grid.countNumericCells(1, 3, 1, 10));
        // 只统计起始列在范围内的 run
        assertEquals(1, grid.countCells(1, 1, 1, 1));
        assertEquals(3, grid.countCells(1, 1, 2, 2));
    }

    @Test
    void shortTuplesAreNotRuns() {
        Grid grid = compactGrid(FrozenPanes.NONE,
                compactRow(1, tuple(1, "a", 7)),
                compactRow(2, tuple(1, "b", null, null, 1)),
                compactRow(3, tuple(1, "c", null, null, 2.0)));

        assertEquals(1, grid.getCell(1, 1).getRunLength());
        assertEquals(1, grid.getCell(2, 1).getRunLength());
        assertEquals(2, grid.getCell(3, 1).getRunLength());
    }

    @Test
    void malformedTuplesAreSkippedOneByOne() {
        Grid grid = compactGrid(FrozenPanes.NONE,
                compactRow(1, tuple(1), tuple(2, "kept"), tuple(), tuple("C", "bad column")),
                new CompactRow(2, Arrays.asList(null, tuple(1, "also kept"))));

        assertEquals(2, grid.size());
        assertEquals("kept", grid.getValue(1, 2));
        assertEquals("also kept", grid.getValue(2, 1));
    }

    @Test
    void suppliedBoundsWin() {
        Grid grid = GridNormalizer.fromCompactRows("s",
                Arrays.asList(compactRow(2, tuple(2, "x"))), SheetBounds.of(1, 1, 10, 5), null);

        assertEquals(SheetBounds.of(1, 1, 10, 5), grid.getBounds());
    }

    @Test
    void inconsistentBoundsFail() {
        assertThrows(MalformedGridException.class, () -> SheetBounds.of(5, 1, 2, 3));
        assertThrows(MalformedGridException.class, () -> SheetBounds.of(1, 4, 2, 3));
        assertThrows(MalformedGridException.class, () -> SheetBounds.fromDimensions(Arrays.asList(1, 1, 1)));
        assertThrows(IllegalArgumentException.class, () -> SheetBounds.fromDimensions(List.of(3, 1, 1, 1)));
    }

    @Test
    void emptyInputGivesEmptyGrid() {
        Grid grid = GridNormalizer.fromCellMap("s", new HashMap<>(), null, null);

        assertTrue(grid.isEmpty());
        assertEquals(SheetBounds.of(1, 1, 1, 1), grid.getBounds());
    }

    @Test
    void frozenHintAcceptsMapAndList() {
        assertEquals(FrozenPanes.of(2, 1), FrozenPanes.parse(ImmutableMap.of("frozen_rows", 2, "frozen_cols", 1)));
        assertEquals(FrozenPanes.of(1, 0), FrozenPanes.parse(ImmutableMap.of("frozen_rows", 1)));
        assertEquals(FrozenPanes.of(3, 0), FrozenPanes.parse(Arrays.asList(3, 0)));
        assertEquals(FrozenPanes.of(0, 2), FrozenPanes.parse(Arrays.asList(0.0, 2.0)));
        assertEquals(FrozenPanes.NONE, FrozenPanes.parse(Arrays.asList(1)));
        assertEquals(FrozenPanes.NONE, FrozenPanes.parse(null));
        assertEquals(FrozenPanes.NONE, FrozenPanes.parse("2,2"));
        assertEquals(FrozenPanes.NONE, FrozenPanes.parse(Arrays.asList(-1, 0)));
        assertFalse(FrozenPanes.NONE.isFrozen());
        assertTrue(FrozenPanes.of(0, 1).isFrozen());
    }

}
