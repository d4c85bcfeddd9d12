package com.gs.ep.pdftranslator.layout;

import java.util.Collections;
import java.util.List;

/**
 * Reports no regions, so every page is translated as plain text.
 */
public class NoLayoutDetector implements LayoutDetector {

    @Override
    public List<LayoutBox> detect(PageImage page, int tileSize) {
        return Collections.emptyList();
    }
}
