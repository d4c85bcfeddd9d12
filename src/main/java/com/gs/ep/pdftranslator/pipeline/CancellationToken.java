package com.gs.ep.pdftranslator.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared by the caller and the pipeline. Work
 * already running on a page finishes; no new page or file is started.
 */
public class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CancellationToken parent;

    public CancellationToken() {
        this(null);
    }

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    /**
     * A token that is cancelled together with this one but can also be cancelled
     * on its own without affecting this one.
     */
    public CancellationToken child() {
        return new CancellationToken(this);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || (parent != null && parent.isCancelled());
    }
}
