package com.pipebroker.broker;

/** Ring buffer entry: either a fresh publish or a retry re-entering dispatch. Reused by the ring. */
final class DispatchSlot {
    /** One attempt of one registration's chain, waiting for dispatch or for a concurrency permit. */
    record Invocation(EventRegistration<?> registration, Object event, RetryPolicy policy, PublishCompletion completion) {}

    private Object event;
    private PublishCompletion completion;
    private Invocation retry;

    void publish(Object payload, PublishCompletion publish) {
        this.event = payload;
        this.completion = publish;
        this.retry = null;
    }

    void retry(Invocation pending) {
        this.event = null;
        this.completion = null;
        this.retry = pending;
    }

    Object event() { return event; }
    PublishCompletion completion() { return completion; }
    Invocation retry() { return retry; }

    void clear() {
        event = null;
        completion = null;
        retry = null;
    }

    @Override
    public String toString() {
        if (retry != null) return "DispatchSlot(retry " + retry.registration() + ")";
        return "DispatchSlot(" + (event == null ? "empty" : event.getClass().getSimpleName()) + ")";
    }
}
