package com.gs.ep.pdftranslator.assemble;

/**
 * Serialized outputs of one translated document.
 */
public class AssembledDocument {
    private final byte[] mono;
    private final byte[] dual;
    private final int pageCount;
    private final int patchesApplied;

    public AssembledDocument(byte[] mono, byte[] dual, int pageCount, int patchesApplied) {
        this.mono = mono;
        this.dual = dual;
        this.pageCount = pageCount;
        this.patchesApplied = patchesApplied;
    }

    /**
     * Translated pages only.
     */
    public byte[] getMono() {
        return mono;
    }

    /**
     * Original and translated pages alternating: original 1, translation 1, original 2, ...
     */
    public byte[] getDual() {
        return dual;
    }

    public int getPageCount() {
        return pageCount;
    }

    public int getPatchesApplied() {
        return patchesApplied;
    }
}
