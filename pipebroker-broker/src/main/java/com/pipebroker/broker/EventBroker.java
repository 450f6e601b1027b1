package com.pipebroker.broker;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * In-process publish/subscribe front door. Each published event is delivered to every registration for its exact
 * runtime class; deliveries run concurrently and independently of each other.
 */
public interface EventBroker extends AutoCloseable {

    /**
     * @throws NullPointerException if {@code event} is null
     * @throws EventBrokerPublishNotAvailableException after {@link #shutdown()}
     */
    CompletableFuture<Void> publish(Object event);

    /**
     * Publishes {@code event} once {@code delay} has elapsed. The returned future follows the eventual publish; it
     * fails with {@link java.util.concurrent.CancellationException} if the broker shuts down first.
     */
    CompletableFuture<Void> publishDeferred(Object event, Duration delay);

    /** Stops accepting events and cancels pending retries and in-flight runs. Idempotent. */
    void shutdown();

    boolean isRunning();

    @Override
    default void close() {
        shutdown();
    }
}
