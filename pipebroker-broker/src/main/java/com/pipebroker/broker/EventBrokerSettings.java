package com.pipebroker.broker;

import java.time.Duration;
import java.util.Objects;

/**
 * @param maxConcurrentHandlers    upper bound on handler invocations running at once
 * @param publishMode              see {@link PublishMode}
 * @param ringBufferSize           dispatch ring capacity, a power of two
 * @param retryPollInterval        how often the retry worker and the dispatcher re-check for shutdown
 * @param disableMissingHandlerWarningLog suppresses the warning logged for events nobody subscribes to
 */
public record EventBrokerSettings(
    int maxConcurrentHandlers,
    PublishMode publishMode,
    int ringBufferSize,
    Duration retryPollInterval,
    boolean disableMissingHandlerWarningLog
) {
    public static final EventBrokerSettings DEFAULT = builder().build();

    public EventBrokerSettings {
        if (maxConcurrentHandlers < 1) throw new IllegalArgumentException("maxConcurrentHandlers must be >= 1");
        publishMode = Objects.requireNonNull(publishMode, "publishMode");
        if (ringBufferSize < 1 || Integer.bitCount(ringBufferSize) != 1) {
            throw new IllegalArgumentException("ringBufferSize must be a power of 2");
        }
        retryPollInterval = Objects.requireNonNull(retryPollInterval, "retryPollInterval");
        if (retryPollInterval.isZero() || retryPollInterval.isNegative()) {
            throw new IllegalArgumentException("retryPollInterval must be > 0");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxConcurrentHandlers = 2;
        private PublishMode publishMode = PublishMode.SCHEDULE;
        private int ringBufferSize = 1024;
        private Duration retryPollInterval = Duration.ofMillis(25);
        private boolean disableMissingHandlerWarningLog;

        private Builder() {}

        public Builder maxConcurrentHandlers(int value) { this.maxConcurrentHandlers = value; return this; }
        public Builder publishMode(PublishMode value) { this.publishMode = value; return this; }
        public Builder ringBufferSize(int value) { this.ringBufferSize = value; return this; }
        public Builder retryPollInterval(Duration value) { this.retryPollInterval = value; return this; }
        public Builder disableMissingHandlerWarningLog(boolean value) { this.disableMissingHandlerWarningLog = value; return this; }

        public EventBrokerSettings build() {
            return new EventBrokerSettings(maxConcurrentHandlers, publishMode, ringBufferSize, retryPollInterval,
                disableMissingHandlerWarningLog);
        }
    }
}
