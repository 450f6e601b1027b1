package com.pipebroker.config;

import com.pipebroker.broker.DisruptorEventBroker;
import com.pipebroker.broker.EventBrokerSettings;
import com.pipebroker.broker.EventRegistration;
import com.pipebroker.broker.RetrySettings;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Result of loading a broker configuration file. */
public record BrokerConfig(
    EventBrokerSettings settings,
    Map<String, RetrySettings> retryProfiles,
    List<EventRegistration<?>> registrations
) {
    public BrokerConfig {
        settings = Objects.requireNonNull(settings, "settings");
        retryProfiles = Map.copyOf(retryProfiles);
        registrations = List.copyOf(registrations);
    }

    /** Broker builder pre-populated with these settings and registrations. */
    public DisruptorEventBroker.Builder brokerBuilder() {
        return DisruptorEventBroker.builder().settings(settings).registerAll(registrations);
    }

    public RetrySettings retryProfile(String name) {
        RetrySettings profile = retryProfiles.get(name);
        if (profile == null) throw new IllegalArgumentException("Unknown retry profile: " + name);
        return profile;
    }
}
