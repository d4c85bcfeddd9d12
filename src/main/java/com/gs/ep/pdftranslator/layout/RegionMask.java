package com.gs.ep.pdftranslator.layout;

import java.util.Arrays;
import java.util.List;

/**
 * Page-sized grid of region ids used to decide which text may be translated.
 *
 * <p>
 * Id {@value #PRESERVE} marks protected content (figures, tables, formulas, abandoned
 * areas) that is copied verbatim. Id {@value #ORDINARY_TEXT} is text outside any
 * detected box. Ids from {@value #FIRST_BOX_ID} upward identify the text box with
 * index {@code id - 2} in detection order.
 * </p>
 *
 * <p>
 * Boxes arrive with a bottom-up y axis; rows of the grid run top-down, so both box
 * edges are flipped with {@code height - y}. Every box is grown by one pixel on
 * each side and clipped to the grid. Protected boxes are stamped after all text
 * boxes, so they win wherever the two overlap.
 * </p>
 */
public final class RegionMask {
    public static final int PRESERVE = 0;
    public static final int ORDINARY_TEXT = 1;
    public static final int FIRST_BOX_ID = 2;

    private final int width;
    private final int height;
    private final int[] cells;

    private RegionMask(int width, int height) {
        this.width = width;
        this.height = height;
        this.cells = new int[width * height];
        Arrays.fill(cells, ORDINARY_TEXT);
    }

    public static RegionMask build(int pageHeight, int pageWidth, List<LayoutBox> boxes) {
        if (pageHeight <= 0 || pageWidth <= 0) {
            throw new IllegalArgumentException("Mask dimensions must be positive: " + pageWidth + "x" + pageHeight);
        }
        RegionMask mask = new RegionMask(pageWidth, pageHeight);
        if (boxes == null || boxes.isEmpty()) {
            return mask;
        }
        for (int i = 0; i < boxes.size(); i++) {
            LayoutBox box = boxes.get(i);
            if (!box.isProtected()) {
                mask.stamp(box, FIRST_BOX_ID + i);
            }
        }
        for (LayoutBox box : boxes) {
            if (box.isProtected()) {
                mask.stamp(box, PRESERVE);
            }
        }
        return mask;
    }

    /**
     * A mask with no detected boxes: the whole page is ordinary text.
     */
    public static RegionMask uniform(int pageHeight, int pageWidth) {
        return build(pageHeight, pageWidth, null);
    }

    private void stamp(LayoutBox box, int regionId) {
        int left = clip((int) (box.x0 - 1), width - 1);
        int top = clip((int) (height - box.y1 - 1), height - 1);
        int right = clip((int) (box.x1 + 1), width - 1);
        int bottom = clip((int) (height - box.y0 + 1), height - 1);
        for (int row = top; row < bottom; row++) {
            int offset = row * width;
            for (int col = left; col < right; col++) {
                cells[offset + col] = regionId;
            }
        }
    }

    private static int clip(int value, int max) {
        return Math.max(0, Math.min(value, max));
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * Region id of a grid cell; row 0 is the top edge of the page.
     */
    public int regionAt(int col, int row) {
        return cells[clip(row, height - 1) * width + clip(col, width - 1)];
    }

    /**
     * Region id under a page point given with a bottom-up y axis, in mask pixels.
     * Points outside the page are clipped to the nearest edge cell.
     */
    public int regionAtPoint(double x, double y) {
        return regionAt((int) Math.floor(x), (int) Math.floor(height - y));
    }

    public static boolean isTranslatable(int regionId) {
        return regionId != PRESERVE;
    }
}
