package com.pipebroker.broker;

import java.time.Duration;
import java.util.Objects;

/**
 * Computes the delay before the next attempt from the attempt that just failed and the previous delay
 * ({@link Duration#ZERO} before the first retry).
 */
@FunctionalInterface
public interface Backoff {
    Duration delay(int attempt, Duration lastDelay);

    static Backoff fixed(Duration delay) {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) throw new IllegalArgumentException("delay must be >= 0");
        return (attempt, lastDelay) -> delay;
    }

    /** Doubles the previous delay, starting at {@code initial} and capped at {@code max}. */
    static Backoff exponential(Duration initial, Duration max) {
        Objects.requireNonNull(initial, "initial");
        Objects.requireNonNull(max, "max");
        if (initial.isNegative() || max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("require 0 <= initial <= max");
        }
        return (attempt, lastDelay) -> {
            if (lastDelay == null || lastDelay.isZero()) return initial;
            Duration doubled = lastDelay.multipliedBy(2);
            return doubled.compareTo(max) > 0 ? max : doubled;
        };
    }
}
