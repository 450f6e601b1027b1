package com.pipebroker.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

public final class SimpleMetricsRecorder implements MetricsRecorder {
    private final MeterRegistry registry;

    public SimpleMetricsRecorder() {
        this.registry = new SimpleMeterRegistry();
    }

    public SimpleMetricsRecorder(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onStepSuccess(String pipeline, String stepName, long nanos) {
        Timer.builder(stepMetric(pipeline, stepName, "duration"))
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void onStepError(String pipeline, String stepName, Throwable t) {
        Counter.builder(stepMetric(pipeline, stepName, "errors"))
                .tag("exception", t.getClass().getSimpleName())
                .register(registry)
                .increment();
    }

    @Override
    public void onShortCircuit(String pipeline, String stepName) {
        Counter.builder(stepMetric(pipeline, stepName, "short_circuits")).register(registry).increment();
    }

    @Override
    public void onHandlerSuccess(String eventType) {
        Counter.builder(brokerMetric(eventType, "handled")).register(registry).increment();
    }

    @Override
    public void onHandlerFailure(String eventType, Throwable t) {
        Counter.builder(brokerMetric(eventType, "failed"))
                .tag("exception", t.getClass().getSimpleName())
                .register(registry)
                .increment();
    }

    @Override
    public void onRetryScheduled(String eventType, int attempt) {
        Counter.builder(brokerMetric(eventType, "retries"))
                .tag("attempt", Integer.toString(attempt))
                .register(registry)
                .increment();
    }

    @Override
    public void onRetryExhausted(String eventType) {
        Counter.builder(brokerMetric(eventType, "exhausted")).register(registry).increment();
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    private static String stepMetric(String pipeline, String step, String name) {
        return "pb.pipeline." + pipeline + ".step." + step + "." + name;
    }

    private static String brokerMetric(String eventType, String name) {
        return "pb.broker." + eventType + "." + name;
    }
}
