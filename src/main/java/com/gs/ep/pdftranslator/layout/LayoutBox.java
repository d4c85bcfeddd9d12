package com.gs.ep.pdftranslator.layout;

import java.util.Objects;

/**
 * One region found by the layout detector on a page raster.
 * Coordinates are raster pixels with the y axis pointing up from the bottom edge.
 */
public class LayoutBox {
    public final LayoutCategory category;
    public final double x0;
    public final double y0;
    public final double x1;
    public final double y1;
    public final double confidence;

    public LayoutBox(LayoutCategory category, double x0, double y0, double x1, double y1, double confidence) {
        this.category = Objects.requireNonNull(category, "category");
        this.x0 = Math.min(x0, x1);
        this.y0 = Math.min(y0, y1);
        this.x1 = Math.max(x0, x1);
        this.y1 = Math.max(y0, y1);
        this.confidence = confidence;
    }

    public LayoutBox(LayoutCategory category, double x0, double y0, double x1, double y1) {
        this(category, x0, y0, x1, y1, 1.0);
    }

    public boolean isProtected() {
        return category.isProtected();
    }

    public double getWidth() {
        return x1 - x0;
    }

    public double getHeight() {
        return y1 - y0;
    }

    @Override
    public String toString() {
        return String.format("%s[%.1f,%.1f,%.1f,%.1f conf=%.2f]", category, x0, y0, x1, y1, confidence);
    }
}
