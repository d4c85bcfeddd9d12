package com.gs.ep.pdftranslator.pipeline;

/**
 * Reported after each page finishes or is skipped.
 */
public class ProgressEvent {
    private final String source;
    private final int pageIndex;
    private final int completedPages;
    private final int totalPages;
    private final boolean skipped;

    public ProgressEvent(String source, int pageIndex, int completedPages, int totalPages, boolean skipped) {
        this.source = source;
        this.pageIndex = pageIndex;
        this.completedPages = completedPages;
        this.totalPages = totalPages;
        this.skipped = skipped;
    }

    /**
     * File name of the document, or "stream" for in-memory input.
     */
    public String getSource() {
        return source;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public int getCompletedPages() {
        return completedPages;
    }

    public int getTotalPages() {
        return totalPages;
    }

    public boolean isSkipped() {
        return skipped;
    }

    @Override
    public String toString() {
        return String.format("%s page %d (%d/%d)%s", source, pageIndex + 1, completedPages, totalPages,
                skipped ? " skipped" : "");
    }
}
