package com.pipebroker.core;

/** Base type of the failures raised by the pipeline and broker runtime. */
public class PipelineException extends RuntimeException {
    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
