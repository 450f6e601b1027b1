package com.pipebroker.broker;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry configuration of one registration.
 *
 * <p>{@code automatic} settings make the broker retry failed runs with {@code backoff} while attempts remain, and
 * call the error hook once when they are exhausted. Manual settings leave retries to the handler or its error hook
 * through {@link RetryPolicy#requestRetry(Duration)}; the hook then runs on every failure that was not already
 * turned into a retry.
 */
public record RetrySettings(int maxAttempts, boolean automatic, Backoff backoff) {
    private static final RetrySettings NONE = new RetrySettings(1, false, null);

    public RetrySettings {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (automatic && backoff == null) throw new IllegalArgumentException("automatic retries need a backoff");
    }

    /** A single attempt; requesting a retry always fails. */
    public static RetrySettings none() {
        return NONE;
    }

    public static RetrySettings manual(int maxAttempts) {
        return new RetrySettings(maxAttempts, false, null);
    }

    public static RetrySettings fixed(int maxRetries, Duration delay) {
        return new RetrySettings(attempts(maxRetries), true, Backoff.fixed(delay));
    }

    public static RetrySettings exponential(int maxRetries, Duration initial, Duration max) {
        return new RetrySettings(attempts(maxRetries), true, Backoff.exponential(initial, max));
    }

    public static RetrySettings custom(int maxRetries, Backoff backoff) {
        return new RetrySettings(attempts(maxRetries), true, Objects.requireNonNull(backoff, "backoff"));
    }

    private static int attempts(int maxRetries) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        return maxRetries + 1;
    }
}
