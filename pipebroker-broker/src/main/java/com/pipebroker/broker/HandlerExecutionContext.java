package com.pipebroker.broker;

import com.pipebroker.core.CancellationToken;
import com.pipebroker.core.pool.ObjectPool;
import com.pipebroker.core.pool.PooledObjectPolicy;

import java.util.concurrent.Semaphore;

/** State of one attempt of one invocation chain. Pooled; owned by exactly one attempt between acquire and release. */
final class HandlerExecutionContext {
    private EventRegistration<?> registration;
    private Object event;
    private RetryPolicy retryPolicy;
    private CancellationToken cancellationToken = CancellationToken.NONE;
    private PublishCompletion completion;
    private Semaphore permits;

    static ObjectPool<HandlerExecutionContext> newPool(int max) {
        return new ObjectPool<>(max, new PooledObjectPolicy<>() {
            @Override
            public HandlerExecutionContext create() {
                return new HandlerExecutionContext();
            }

            @Override
            public boolean reset(HandlerExecutionContext context) {
                // a context still holding a permit was not finished properly; do not reuse it
                boolean clean = context.permits == null;
                context.clear();
                return clean;
            }
        });
    }

    HandlerExecutionContext init(EventRegistration<?> target, Object payload, RetryPolicy policy,
                                 CancellationToken token, PublishCompletion publish, Semaphore heldPermits) {
        this.registration = target;
        this.event = payload;
        this.retryPolicy = policy;
        this.cancellationToken = token;
        this.completion = publish;
        this.permits = heldPermits;
        return this;
    }

    EventRegistration<?> registration() { return registration; }
    Object event() { return event; }
    RetryPolicy retryPolicy() { return retryPolicy; }
    CancellationToken cancellationToken() { return cancellationToken; }
    PublishCompletion completion() { return completion; }

    void releasePermit() {
        if (permits != null) {
            permits.release();
            permits = null;
        }
    }

    private void clear() {
        registration = null;
        event = null;
        retryPolicy = null;
        cancellationToken = CancellationToken.NONE;
        completion = null;
        permits = null;
    }
}
