package com.gs.ep.pdftranslator.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Run options of the orchestrator.
 */
public class PipelineOptions {
    private final int threads;
    private final List<Integer> pages;
    private final boolean compatible;

    public PipelineOptions(int threads, List<Integer> pages, boolean compatible) {
        if (threads < 1) {
            throw new IllegalArgumentException("At least one worker thread is required, got " + threads);
        }
        this.threads = threads;
        this.pages = pages == null ? Collections.<Integer>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(pages));
        this.compatible = compatible;
    }

    public PipelineOptions(int threads, List<Integer> pages) {
        this(threads, pages, false);
    }

    public PipelineOptions(int threads) {
        this(threads, null);
    }

    public int getThreads() {
        return threads;
    }

    /**
     * 0-based pages to translate; empty means all pages.
     */
    public List<Integer> getPages() {
        return pages;
    }

    /**
     * Whether input files are rewritten as PDF/A before translation.
     */
    public boolean isCompatible() {
        return compatible;
    }
}
