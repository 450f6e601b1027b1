package com.pipebroker.core;

import java.util.Objects;

/**
 * Outcome of one pipeline run.
 *
 * <p>{@code context} is the caller's own run context when one was supplied, otherwise an immutable snapshot of the
 * pooled context used for the run.
 */
public record PipelineRunResult(
    boolean successful,
    Exception exception,
    RunContextView context,
    int failedStepIndex,
    String failedStepName,
    long totalNanos
) {
    public PipelineRunResult {
        context = Objects.requireNonNull(context, "context");
        if (successful && exception != null) throw new IllegalArgumentException("successful run cannot carry an exception");
        if (!successful && exception == null) throw new IllegalArgumentException("failed run requires an exception");
    }

    static PipelineRunResult succeeded(RunContextView context, long totalNanos) {
        return new PipelineRunResult(true, null, context, -1, null, totalNanos);
    }

    static PipelineRunResult failed(Exception exception, RunContextView context, int stepIndex, String stepName, long totalNanos) {
        return new PipelineRunResult(false, exception, context, stepIndex, stepName, totalNanos);
    }

    public boolean isSuccessful() {
        return successful;
    }
}
