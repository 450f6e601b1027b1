package com.pipebroker.broker;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Completion of one publish. Counts the invocation chains started for the event plus one for the dispatch itself;
 * the future completes when the count drops to zero, or as soon as dispatch finishes in
 * {@link PublishMode#SCHEDULE} mode.
 */
final class PublishCompletion {
    private final CompletableFuture<Void> future = new CompletableFuture<>();
    private final AtomicInteger outstanding = new AtomicInteger(1);
    private final AtomicReference<HandlerExecutionException> failure = new AtomicReference<>();
    private final PublishMode mode;

    PublishCompletion(PublishMode mode) {
        this.mode = mode;
    }

    CompletableFuture<Void> future() {
        return future;
    }

    void chainStarted() {
        outstanding.incrementAndGet();
    }

    /** Dispatch has started or queued every chain. */
    void dispatched() {
        if (mode == PublishMode.SCHEDULE) {
            future.complete(null);
        }
        chainEnded();
    }

    void chainEnded() {
        if (outstanding.decrementAndGet() == 0) {
            HandlerExecutionException error = failure.get();
            if (error != null) {
                future.completeExceptionally(error);
            } else {
                future.complete(null);
            }
        }
    }

    void chainFailed(HandlerExecutionException exception) {
        if (!failure.compareAndSet(null, exception)) {
            failure.get().addSuppressed(exception);
        }
        chainEnded();
    }

    void cancel() {
        future.completeExceptionally(new CancellationException("EventBroker stopped"));
    }
}
