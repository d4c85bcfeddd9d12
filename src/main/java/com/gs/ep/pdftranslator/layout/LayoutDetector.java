package com.gs.ep.pdftranslator.layout;

import java.io.IOException;
import java.util.List;

/**
 * Finds layout regions on a rendered page. Called once per page, possibly from
 * several worker threads at the same time.
 */
public interface LayoutDetector {

    /**
     * @param page     rendered page, one pixel per PDF point
     * @param tileSize model input size derived from the raster height
     * @return detected boxes in detection order, bottom-up y axis; empty when nothing was found
     */
    List<LayoutBox> detect(PageImage page, int tileSize) throws IOException;
}
