package com.pipebroker.broker;

/** When the future returned by {@link EventBroker#publish(Object)} completes. */
public enum PublishMode {
    /** Once every invocation for the event has been started or queued for a free handler slot. */
    SCHEDULE,
    /**
     * Once every invocation chain, retries included, has terminated. The future fails with a
     * {@link HandlerExecutionException} when a chain ended in a failure that no error hook handled.
     */
    AWAIT_COMPLETION
}
