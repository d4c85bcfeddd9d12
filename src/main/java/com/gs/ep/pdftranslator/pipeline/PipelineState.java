package com.gs.ep.pdftranslator.pipeline;

/**
 * Lifecycle of one document run.
 */
public enum PipelineState {
    IDLE,
    OPENING,
    PER_PAGE,
    ASSEMBLING,
    DONE,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == CANCELLED || this == FAILED;
    }
}
