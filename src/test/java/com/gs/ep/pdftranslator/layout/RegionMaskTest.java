package com.gs.ep.pdftranslator.layout;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class RegionMaskTest {

    @Test
    void build_withNoBoxes_shouldMarkEveryCellOrdinaryText() {
        RegionMask mask = RegionMask.build(50, 40, Collections.emptyList());

        assertEquals(40, mask.getWidth());
        assertEquals(50, mask.getHeight());
        for (int row = 0; row < 50; row++) {
            for (int col = 0; col < 40; col++) {
                assertEquals(RegionMask.ORDINARY_TEXT, mask.regionAt(col, row));
            }
        }
    }

    @Test
    void build_withTextBox_shouldFlipYAxisAndGrowByOnePixel() {
        LayoutBox text = new LayoutBox(LayoutCategory.TEXT, 10, 20, 30, 40);
        RegionMask mask = RegionMask.build(100, 100, Collections.singletonList(text));

        assertEquals(RegionMask.FIRST_BOX_ID, mask.regionAtPoint(15, 30));
        // rows 59..80 and columns 9..30 after flipping and growing
        assertEquals(RegionMask.FIRST_BOX_ID, mask.regionAt(9, 59));
        assertEquals(RegionMask.FIRST_BOX_ID, mask.regionAt(30, 80));
        assertEquals(RegionMask.ORDINARY_TEXT, mask.regionAt(8, 70));
        assertEquals(RegionMask.ORDINARY_TEXT, mask.regionAt(31, 70));
        assertEquals(RegionMask.ORDINARY_TEXT, mask.regionAt(15, 58));
        assertEquals(RegionMask.ORDINARY_TEXT, mask.regionAt(15, 81));
        assertEquals(RegionMask.ORDINARY_TEXT, mask.regionAtPoint(5, 30));
    }

    @Test
    void build_withProtectedBoxInsideTextBox_shouldLetProtectedWin() {
        LayoutBox figure = new LayoutBox(LayoutCategory.FIGURE, 40, 40, 60, 60);
        LayoutBox text = new LayoutBox(LayoutCategory.TEXT, 0, 0, 100, 100);
        RegionMask mask = RegionMask.build(100, 100, Arrays.asList(figure, text));

        assertEquals(RegionMask.PRESERVE, mask.regionAtPoint(50, 50));
        // text box is second in detection order
        assertEquals(RegionMask.FIRST_BOX_ID + 1, mask.regionAtPoint(10, 10));
        assertFalse(RegionMask.isTranslatable(mask.regionAtPoint(50, 50)));
        assertTrue(RegionMask.isTranslatable(mask.regionAtPoint(10, 10)));
    }

    @Test
    void build_withBoxesInDetectionOrder_shouldAssignDistinctIds() {
        LayoutBox title = new LayoutBox(LayoutCategory.TITLE, 0, 80, 100, 100);
        LayoutBox body = new LayoutBox(LayoutCategory.PLAIN_TEXT, 0, 0, 100, 60);
        RegionMask mask = RegionMask.build(100, 100, Arrays.asList(title, body));

        assertEquals(RegionMask.FIRST_BOX_ID, mask.regionAtPoint(50, 90));
        assertEquals(RegionMask.FIRST_BOX_ID + 1, mask.regionAtPoint(50, 30));
        assertEquals(RegionMask.ORDINARY_TEXT, mask.regionAtPoint(50, 70));
    }

    @Test
    void build_withBoxOutsidePage_shouldClipToGrid() {
        LayoutBox table = new LayoutBox(LayoutCategory.TABLE, -50, -50, 500, 20);
        RegionMask mask = RegionMask.build(100, 100, Collections.singletonList(table));

        assertEquals(RegionMask.PRESERVE, mask.regionAtPoint(0, 1));
        assertEquals(RegionMask.ORDINARY_TEXT, mask.regionAtPoint(50, 50));
    }

    @Test
    void regionAtPoint_outsidePage_shouldClipToNearestEdgeCell() {
        LayoutBox figure = new LayoutBox(LayoutCategory.FIGURE, 0, 90, 10, 100);
        RegionMask mask = RegionMask.build(100, 100, Collections.singletonList(figure));

        assertEquals(RegionMask.PRESERVE, mask.regionAtPoint(-5, 500));
        assertEquals(RegionMask.ORDINARY_TEXT, mask.regionAtPoint(500, -500));
    }

    @Test
    void build_withNonPositiveDimensions_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> RegionMask.build(0, 10, null));
        assertThrows(IllegalArgumentException.class, () -> RegionMask.uniform(10, -1));
    }
}
