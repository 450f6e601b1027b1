package com.pipebroker.metrics;

import io.micrometer.core.instrument.MeterRegistry;

public interface MetricsRecorder {
    void onStepSuccess(String pipeline, String stepName, long nanos);
    void onStepError(String pipeline, String stepName, Throwable t);
    void onShortCircuit(String pipeline, String stepName);

    void onHandlerSuccess(String eventType);
    void onHandlerFailure(String eventType, Throwable t);
    void onRetryScheduled(String eventType, int attempt);
    void onRetryExhausted(String eventType);

    MeterRegistry registry();
}
