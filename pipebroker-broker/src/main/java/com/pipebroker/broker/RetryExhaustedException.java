package com.pipebroker.broker;

import com.pipebroker.core.PipelineException;

/** A retry was requested after the maximum number of attempts was reached. */
public final class RetryExhaustedException extends PipelineException {
    private final int attempts;
    private final int maxAttempts;

    public RetryExhaustedException(int attempts, int maxAttempts) {
        super("Retry exhausted after " + attempts + " of " + maxAttempts + " attempts");
        this.attempts = attempts;
        this.maxAttempts = maxAttempts;
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
