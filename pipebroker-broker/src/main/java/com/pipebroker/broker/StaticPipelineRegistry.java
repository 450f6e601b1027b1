package com.pipebroker.broker;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Registrations fixed at broker construction. */
public final class StaticPipelineRegistry implements PipelineRegistry {
    private final Map<Class<?>, List<EventRegistration<?>>> byType;

    private StaticPipelineRegistry(Map<Class<?>, List<EventRegistration<?>>> byType) {
        this.byType = byType;
    }

    public static StaticPipelineRegistry of(List<? extends EventRegistration<?>> registrations) {
        Objects.requireNonNull(registrations, "registrations");
        Map<Class<?>, List<EventRegistration<?>>> grouped = new LinkedHashMap<>();
        for (EventRegistration<?> registration : registrations) {
            Objects.requireNonNull(registration, "registration");
            grouped.computeIfAbsent(registration.eventType(), k -> new ArrayList<>()).add(registration);
        }
        Map<Class<?>, List<EventRegistration<?>>> frozen = new LinkedHashMap<>();
        grouped.forEach((type, list) -> frozen.put(type, List.copyOf(list)));
        return new StaticPipelineRegistry(Map.copyOf(frozen));
    }

    @Override
    public List<EventRegistration<?>> registrationsFor(Class<?> eventType) {
        return byType.getOrDefault(eventType, List.of());
    }

    public int size() {
        return byType.values().stream().mapToInt(List::size).sum();
    }
}
