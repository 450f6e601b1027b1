package com.pipebroker.core;

public final class CancellationSource {
    private final CancellationToken token = new CancellationToken(this);
    private volatile boolean cancelled;

    public CancellationToken token() {
        return token;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /** Requests cancellation. Idempotent. */
    public void cancel() {
        cancelled = true;
    }
}
