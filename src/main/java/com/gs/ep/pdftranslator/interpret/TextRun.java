package com.gs.ep.pdftranslator.interpret;

import org.apache.pdfbox.util.Matrix;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.awt.geom.Point2D;

/**
 * Contiguous text shows of one region inside a single BT/ET block, translated as
 * one unit. A run keeps its visual lines so the translation can be laid back
 * over them.
 */
public class TextRun {
    private final int regionId;
    final MutableList<ContentOperation> shows = Lists.mutable.empty();
    final MutableList<Line> lines = Lists.mutable.empty();

    // Text state after the last show, for putting the text matrix back
    Matrix endLineMatrix;
    float endLineAdvance;
    TextStateSnapshot endState;

    private int index = -1;
    private volatile String translation;

    TextRun(int regionId) {
        this.regionId = regionId;
    }

    static final class Line {
        final StringBuilder text = new StringBuilder();
        final Point2D.Float origin;
        final float dirX;
        final float dirY;
        final float horizontalScale;
        final float fontSizeDevice;
        Point2D.Float end;

        Line(Point2D.Float origin, float dirX, float dirY, float horizontalScale, float fontSizeDevice) {
            this.origin = origin;
            this.end = origin;
            this.dirX = dirX;
            this.dirY = dirY;
            this.horizontalScale = horizontalScale;
            this.fontSizeDevice = fontSizeDevice;
        }

        /**
         * Distance of a point from this line's baseline.
         */
        float offBaseline(Point2D.Float p) {
            return Math.abs(dirX * (p.y - origin.y) - dirY * (p.x - origin.x));
        }

        /**
         * Gap along the baseline between the end of the text so far and a point.
         */
        float gapTo(Point2D.Float p) {
            return dirX * (p.x - end.x) + dirY * (p.y - end.y);
        }

        /**
         * Width of the line in unscaled text space units.
         */
        float getWidth() {
            float along = dirX * (end.x - origin.x) + dirY * (end.y - origin.y);
            return horizontalScale <= 0 ? 0 : Math.max(0, along / horizontalScale);
        }

        String getText() {
            return text.toString().trim();
        }
    }

    public int getRegionId() {
        return regionId;
    }

    public int getIndex() {
        return index;
    }

    void setIndex(int index) {
        this.index = index;
    }

    public int getLineCount() {
        return lines.size();
    }

    public float[] getLineWidths() {
        float[] widths = new float[lines.size()];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = lines.get(i).getWidth();
        }
        return widths;
    }

    /**
     * The run's text with its lines joined by single spaces.
     */
    public String getText() {
        StringBuilder sb = new StringBuilder();
        for (Line line : lines) {
            String text = line.getText();
            if (text.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(text);
        }
        return sb.toString();
    }

    public boolean hasLetters() {
        String text = getText();
        for (int i = 0; i < text.length(); i++) {
            if (Character.isLetter(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    public String getTranslation() {
        return translation;
    }

    public void setTranslation(String translation) {
        this.translation = translation;
    }

    public boolean isTranslated() {
        return translation != null;
    }

    @Override
    public String toString() {
        return "TextRun[" + index + ", region=" + regionId + ", lines=" + lines.size() + ", text=" + getText() + "]";
    }
}
