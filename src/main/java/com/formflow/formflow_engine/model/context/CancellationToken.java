package com.formflow.formflow_engine.model.context;

/**
 * Cooperative cancellation flag. A child token reports cancelled when it or any ancestor is.
 */
public class CancellationToken {

    private final CancellationToken parent;
    private volatile boolean cancelled;

    public CancellationToken() {
        this(null);
    }

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    public CancellationToken child() {
        return new CancellationToken(this);
    }

    public void cancel() {
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || (parent != null && parent.isCancelled());
    }
}
