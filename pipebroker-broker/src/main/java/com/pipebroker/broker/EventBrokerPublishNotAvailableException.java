package com.pipebroker.broker;

import com.pipebroker.core.PipelineException;

/** Thrown by publish operations once the broker has been shut down. */
public final class EventBrokerPublishNotAvailableException extends PipelineException {
    public EventBrokerPublishNotAvailableException() {
        super("EventBroker is stopped");
    }
}
