package com.pipebroker.broker;

import com.pipebroker.core.CancellationToken;

/** Error callback for pipeline registrations. May request a retry through {@code retryPolicy}. */
@FunctionalInterface
public interface ErrorHook<E> {
    void onError(Exception exception, E event, RetryPolicy retryPolicy, CancellationToken cancellationToken)
        throws Exception;
}
