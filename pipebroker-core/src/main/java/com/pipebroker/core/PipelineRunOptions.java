package com.pipebroker.core;

/**
 * @param scopePerStep create a fresh external scope for every step (default) rather than one per run
 */
public record PipelineRunOptions(boolean scopePerStep) {
    public static final PipelineRunOptions DEFAULT = new PipelineRunOptions(true);
}
