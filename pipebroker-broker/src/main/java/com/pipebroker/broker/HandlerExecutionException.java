package com.pipebroker.broker;

import com.pipebroker.core.PipelineException;

import java.util.Objects;

/** Terminal failure of one invocation chain, reported to logs and to callers awaiting a publish. */
public final class HandlerExecutionException extends PipelineException {
    private final Class<?> eventType;
    private final String pipelineName;

    public HandlerExecutionException(Class<?> eventType, String pipelineName, Throwable cause) {
        super("Pipeline '" + pipelineName + "' failed handling " + eventType.getName(), cause);
        this.eventType = Objects.requireNonNull(eventType, "eventType");
        this.pipelineName = pipelineName;
    }

    public Class<?> eventType() {
        return eventType;
    }

    public String pipelineName() {
        return pipelineName;
    }
}
