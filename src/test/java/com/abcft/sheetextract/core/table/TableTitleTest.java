package com.abcft.sheetextract.core.table;

import com.abcft.sheetextract.core.grid.Grid;
import com.abcft.sheetextract.core.table.detectors.DetectionMethod;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.Test;

import static com.abcft.sheetextract.core.grid.GridFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class TableTitleTest {

    @Test
    void titleText() {
        assertTrue(TableTitle.isTitleText("Quarterly Sales"));
        assertTrue(TableTitle.isTitleText("  Top Customers  "));
        assertFalse(TableTitle.isTitleText("ab"));
        assertFalse(TableTitle.isTitleText("12.5%"));
        assertFalse(TableTitle.isTitleText("Sales 2023"));
        assertFalse(TableTitle.isTitleText("Revenue for Jan"));
        assertFalse(TableTitle.isTitleText("---"));
        assertFalse(TableTitle.isTitleText(null));
        assertFalse(TableTitle.isTitleText(StringUtils.repeat('x', 101)));
    }

    @Test
    void titleAboveRegion() {
        Grid grid = grid(
                row("Inventory Report"),
                row("Item", "Qty"),
                row("Bolt", 3));
        TableRegion region = new TableRegion(2, 3, 1, 2, DetectionMethod.GAPS);

        TableTitle title = TableTitle.findTitle(grid, region);

        assertNotNull(title);
        assertEquals("Inventory Report", title.getText());
        assertEquals(1, title.getRow());
        assertFalse(title.isInside(region));
    }

    @Test
    void titleOnFirstRow() {
        Grid grid = grid(
                row("Inventory Report"),
                row("Item", "Qty"),
                row("Bolt", 3));
        TableRegion region = TableRegion.of(grid.getBounds(), DetectionMethod.CONTENT_STRUCTURE);

        TableTitle title = TableTitle.findTitle(grid, region);

        assertNotNull(title);
        assertTrue(title.isInside(region));
    }

    @Test
    void noTitle() {
        Grid grid = grid(
                row(null, "Inventory Report"),
                row("Item", "Qty"),
                row("Bolt", 3));
        assertNull(TableTitle.findTitle(grid, TableRegion.of(grid.getBounds(), DetectionMethod.DEFAULT)));

        Grid single = grid(row("Inventory Report"));
        assertNull(TableTitle.findTitle(single, TableRegion.of(single.getBounds(), DetectionMethod.DEFAULT)));

        Grid numeric = grid(row(2024), row("Item", "Qty"), row("Bolt", 3));
        assertNull(TableTitle.findTitle(numeric, TableRegion.of(numeric.getBounds(), DetectionMethod.DEFAULT)));
    }

}
