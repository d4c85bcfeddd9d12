package com.gs.ep.pdftranslator.interpret;

import org.apache.pdfbox.pdmodel.PDPage;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;

/**
 * Decoded content of one page: its operations in program order and the text runs
 * found among them.
 */
public class PageProgram {
    private final int pageIndex;
    private final PDPage page;
    private final MutableList<ContentOperation> operations;
    private final MutableList<TextRun> runs;

    PageProgram(int pageIndex, PDPage page, MutableList<ContentOperation> operations, MutableList<TextRun> runs) {
        this.pageIndex = pageIndex;
        this.page = page;
        this.operations = operations;
        this.runs = runs;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public PDPage getPage() {
        return page;
    }

    public ListIterable<ContentOperation> getOperations() {
        return operations.asUnmodifiable();
    }

    public ListIterable<TextRun> getRuns() {
        return runs.asUnmodifiable();
    }

    public int getTranslatedRunCount() {
        return runs.count(TextRun::isTranslated);
    }
}
