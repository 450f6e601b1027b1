package com.pipebroker.metrics;

import io.micrometer.core.instrument.MeterRegistry;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide {@link MetricsRecorder} shared by pipeline runners and event brokers. A runner captures the recorder
 * when it starts, so a replacement applies to runs started afterwards.
 */
public final class Metrics {
    private static final AtomicReference<MetricsRecorder> RECORDER =
        new AtomicReference<>(new SimpleMetricsRecorder());

    private Metrics() {}

    public static MetricsRecorder recorder() {
        return RECORDER.get();
    }

    /** Installs {@code next} and returns the recorder it replaced. */
    public static MetricsRecorder setRecorder(MetricsRecorder next) {
        return RECORDER.getAndSet(Objects.requireNonNull(next, "recorder"));
    }

    /** Records into {@code registry} from now on. */
    public static MetricsRecorder useRegistry(MeterRegistry registry) {
        return setRecorder(new SimpleMetricsRecorder(Objects.requireNonNull(registry, "registry")));
    }

    public static MeterRegistry registry() {
        return recorder().registry();
    }
}
