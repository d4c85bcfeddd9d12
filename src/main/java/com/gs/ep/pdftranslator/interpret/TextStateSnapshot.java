package com.gs.ep.pdftranslator.interpret;

import org.apache.pdfbox.cos.COSName;

/**
 * Text state parameters in effect at one show, needed to restore them after a
 * translated line is written.
 */
final class TextStateSnapshot {
    final COSName fontName;
    final float fontSize;
    final float charSpacing;
    final float wordSpacing;
    final float horizontalScaling;

    TextStateSnapshot(COSName fontName, float fontSize, float charSpacing, float wordSpacing,
            float horizontalScaling) {
        this.fontName = fontName;
        this.fontSize = fontSize;
        this.charSpacing = charSpacing;
        this.wordSpacing = wordSpacing;
        this.horizontalScaling = horizontalScaling;
    }
}
