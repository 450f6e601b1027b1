package com.pipebroker.core;

/**
 * Continuation handed to a step that declares it: runs the remaining steps of the pipeline.
 *
 * <p>A step that never calls {@link #run()} short-circuits the run. Calling it from the last step has no effect.
 */
@FunctionalInterface
public interface Next {
    void run() throws Exception;
}
