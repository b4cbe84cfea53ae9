package com.abcft.sheetextract.core.table;

import com.abcft.sheetextract.core.grid.FrozenPanes;
import com.abcft.sheetextract.core.grid.Grid;
import com.abcft.sheetextract.core.table.detectors.DetectionMethod;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static com.abcft.sheetextract.core.grid.GridFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CellHeaderResolverTest {

    private static Map<String, HeaderContext> resolve(Grid grid) {
        TableRegion region = TableRegion.of(grid.getBounds(), DetectionMethod.DEFAULT);
        return CellHeaderResolver.resolve(grid, region, HeaderResolver.resolve(region, grid.getFrozenPanes()));
    }

    @Test
    void singleLevelHeaders() {
        Grid grid = grid(
                row("Region", "Q1", "Q2"),
                row("North", 10, 20),
                row("South", 30, "n/a"),
                row("West", "A long free text note", true));

        Map<String, HeaderContext> contexts = resolve(grid);

        assertEquals(Arrays.asList("B2", "C2", "B3", "B4", "C4"), Arrays.asList(contexts.keySet().toArray()));
        HeaderContext context = contexts.get("C2");
        assertEquals(Collections.singletonList("Q2"), context.getFullColumnPath());
        assertEquals(Collections.singletonList("North"), context.getFullRowPath());
        assertEquals("Q2", context.getPrimaryColumnHeader());
        assertEquals("North", context.getPrimaryRowHeader());
        assertEquals(1, context.getColumnHeaderLevels());
        assertEquals(1, context.getRowHeaderLevels());
        HeaderLevel column = context.getColumnHeaders().get(0);
        assertEquals("C1", column.getCoordinate());
        assertEquals(1, column.getLevel());
        assertEquals(1, column.getRow());
        assertEquals(3, column.getColumn());
        assertFalse(contexts.containsKey("C3"));
        assertFalse(contexts.containsKey("A2"));
    }

    @Test
    void frozenMultiLevelHeaders() {
        Grid grid = grid(FrozenPanes.of(2, 1),
                row(null, "2023", null),
                row("Item", "Jan", "Feb"),
                row("Bolt", 5, 6));

        Map<String, HeaderContext> contexts = resolve(grid);

        HeaderContext jan = contexts.get("B3");
        assertEquals(Arrays.asList("2023", "Jan"), jan.getFullColumnPath());
        assertEquals("2023", jan.getPrimaryColumnHeader());
        assertEquals(2, jan.getColumnHeaderLevels());
        assertEquals(Collections.singletonList("Bolt"), jan.getFullRowPath());

        HeaderContext feb = contexts.get("C3");
        assertEquals(Collections.singletonList("Feb"), feb.getFullColumnPath());
        assertEquals(2, feb.getColumnHeaders().get(0).getLevel());
    }

    @Test
    void noHeaders() {
        Grid grid = grid(row(1, 2, 3));
        TableRegion region = new TableRegion(1, 1, 2, 3, DetectionMethod.DEFAULT);
        HeaderInfo info = HeaderResolver.resolve(region, FrozenPanes.NONE);

        Map<String, HeaderContext> contexts = CellHeaderResolver.resolve(grid, region, info);

        HeaderContext context = contexts.get("C1");
        assertNotNull(context);
        assertTrue(context.getFullColumnPath().isEmpty());
        assertNull(context.getPrimaryColumnHeader());
        assertFalse(contexts.containsKey("B1"));
    }

}
