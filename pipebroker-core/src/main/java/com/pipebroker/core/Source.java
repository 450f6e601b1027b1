package com.pipebroker.core;

/** Where a step parameter is looked up first. */
public enum Source {
    /** The {@link PipelineRunContext} of the current run. */
    RUN_CONTEXT,

    /** The host {@link com.pipebroker.core.scope.ServiceScope} created for the step or run. */
    EXTERNAL_SCOPE
}
