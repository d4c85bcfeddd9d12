package com.gs.ep.pdftranslator.pipeline;

/**
 * Receives page progress. Always called on the thread that runs the pipeline,
 * never on a worker thread.
 */
public interface ProgressListener {

    ProgressListener NONE = event -> {
    };

    void onProgress(ProgressEvent event);
}
