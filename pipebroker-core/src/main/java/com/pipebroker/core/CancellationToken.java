package com.pipebroker.core;

import java.util.concurrent.CancellationException;

/**
 * Read side of a {@link CancellationSource}. Cancellation is cooperative: code observes it at the points where it
 * checks the token.
 */
public final class CancellationToken {
    public static final CancellationToken NONE = new CancellationToken(null);

    private final CancellationSource source;

    CancellationToken(CancellationSource source) {
        this.source = source;
    }

    public boolean isCancellationRequested() {
        return source != null && source.isCancelled();
    }

    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("Operation was cancelled");
        }
    }

    @Override
    public String toString() {
        return "CancellationToken(" + (isCancellationRequested() ? "cancelled" : "active") + ")";
    }
}
