package com.pipebroker.broker;

import com.pipebroker.core.CancellationToken;

/**
 * Handler for one event type. A new instance is obtained from the registration's factory for every attempt,
 * and the error hook of that attempt runs on the same instance.
 */
public interface EventHandler<E> {
    void handle(E event, RetryPolicy retryPolicy, CancellationToken cancellationToken) throws Exception;

    /** Called with the failure of {@link #handle}. May request a retry through {@code retryPolicy}. */
    default void onError(Exception exception, E event, RetryPolicy retryPolicy, CancellationToken cancellationToken)
        throws Exception {
    }
}
