package com.pipebroker.broker;

import java.util.List;

/** Source of the registrations the broker dispatches to. */
@FunctionalInterface
public interface PipelineRegistry {
    /**
     * Registrations for exactly {@code eventType} (no supertype matching). The returned list is a stable snapshot
     * that later registry changes do not affect.
     */
    List<EventRegistration<?>> registrationsFor(Class<?> eventType);
}
