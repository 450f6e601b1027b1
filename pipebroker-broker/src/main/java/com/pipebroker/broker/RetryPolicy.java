package com.pipebroker.broker;

import java.time.Duration;
import java.util.Objects;

/**
 * Attempt bookkeeping for one invocation chain (an event delivered to one registration, including its retries).
 *
 * <p>{@link #attempt()} is 1 during the first execution. Each successful {@code requestRetry} call moves the counter
 * forward by one and marks the current execution for re-delivery after the requested delay; the counter never
 * exceeds {@link #maxAttempts()}.
 *
 * <p>Confined to the thread running the current attempt. Instances are pooled by the broker and must not be kept
 * after the handler returns.
 */
public final class RetryPolicy {
    private int maxAttempts;
    private int attempt;
    private Duration lastDelay = Duration.ZERO;
    private boolean retryRequested;

    RetryPolicy() {}

    /** Standalone policy, mainly for tests and for code that drives retries by hand. */
    public static RetryPolicy create(int maxAttempts) {
        RetryPolicy policy = new RetryPolicy();
        policy.start(maxAttempts);
        return policy;
    }

    public int attempt() {
        return attempt;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /** Delay of the most recent retry request, {@link Duration#ZERO} if none. */
    public Duration lastDelay() {
        return lastDelay;
    }

    public boolean retryRequested() {
        return retryRequested;
    }

    public boolean canRetry() {
        return attempt < maxAttempts;
    }

    /**
     * Schedules another attempt after {@code delay}.
     *
     * @throws RetryExhaustedException when the attempt counter would exceed the maximum; the counter is unchanged
     */
    public void requestRetry(Duration delay) {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) throw new IllegalArgumentException("delay must be >= 0");
        if (!canRetry()) {
            throw new RetryExhaustedException(attempt, maxAttempts);
        }
        attempt++;
        lastDelay = delay;
        retryRequested = true;
    }

    /** Schedules another attempt, computing the delay from the current attempt and the previous delay. */
    public void requestRetry(Backoff backoff) {
        Objects.requireNonNull(backoff, "backoff");
        if (!canRetry()) {
            throw new RetryExhaustedException(attempt, maxAttempts);
        }
        requestRetry(Objects.requireNonNull(backoff.delay(attempt, lastDelay), "backoff.delay"));
    }

    void start(int max) {
        if (max < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.maxAttempts = max;
        this.attempt = 1;
        this.lastDelay = Duration.ZERO;
        this.retryRequested = false;
    }

    /** Called when a requested retry begins executing. */
    void beginRetry() {
        retryRequested = false;
    }

    void clear() {
        maxAttempts = 0;
        attempt = 0;
        lastDelay = Duration.ZERO;
        retryRequested = false;
    }

    @Override
    public String toString() {
        return "RetryPolicy(attempt=" + attempt + "/" + maxAttempts + ", lastDelay=" + lastDelay
            + (retryRequested ? ", retryRequested" : "") + ")";
    }
}
