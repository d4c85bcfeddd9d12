package com.gs.ep.pdftranslator.layout;

import java.awt.image.BufferedImage;

/**
 * Raster of one page handed to the layout detector.
 */
public class PageImage {
    private final int pageIndex;
    private final BufferedImage image;

    public PageImage(int pageIndex, BufferedImage image) {
        this.pageIndex = pageIndex;
        this.image = image;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public BufferedImage getImage() {
        return image;
    }

    public int getWidth() {
        return image.getWidth();
    }

    public int getHeight() {
        return image.getHeight();
    }

    /**
     * Detector input size: the raster height rounded down to a multiple of 32.
     */
    public int getTileSize() {
        return Math.max(32, (getHeight() / 32) * 32);
    }
}
