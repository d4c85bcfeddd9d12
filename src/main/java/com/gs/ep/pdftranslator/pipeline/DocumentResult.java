package com.gs.ep.pdftranslator.pipeline;

import com.gs.ep.pdftranslator.assemble.AssembledDocument;
import com.gs.ep.pdftranslator.document.ObjectPatch;

import java.util.Collections;
import java.util.List;

/**
 * Result of translating one document in memory. A run cancelled part way carries
 * the patches finished before cancellation and output documents in which every
 * other page is left untranslated; a run cancelled before it opened the document
 * has neither.
 */
public class DocumentResult {
    private final PipelineState state;
    private final List<ObjectPatch> patches;
    private final AssembledDocument assembled;

    public DocumentResult(PipelineState state, List<ObjectPatch> patches, AssembledDocument assembled) {
        this.state = state;
        this.patches = Collections.unmodifiableList(patches);
        this.assembled = assembled;
    }

    public PipelineState getState() {
        return state;
    }

    public List<ObjectPatch> getPatches() {
        return patches;
    }

    public boolean isCompleted() {
        return state == PipelineState.DONE;
    }

    /**
     * Null when the run was cancelled before it started.
     */
    public byte[] getMono() {
        return assembled == null ? null : assembled.getMono();
    }

    /**
     * Null when the run was cancelled before it started.
     */
    public byte[] getDual() {
        return assembled == null ? null : assembled.getDual();
    }
}
