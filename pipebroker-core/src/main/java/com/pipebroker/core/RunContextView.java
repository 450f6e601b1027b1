package com.pipebroker.core;

import java.util.Optional;
import java.util.Set;

/** Read-only view of the values carried by a pipeline run, keyed by exact type. */
public interface RunContextView {
    /** Value stored under {@code type}, or {@code null}. */
    <T> T get(Class<T> type);

    default <T> Optional<T> find(Class<T> type) {
        return Optional.ofNullable(get(type));
    }

    boolean contains(Class<?> type);

    int size();

    Set<Class<?>> types();

    /** Failure captured for the run, or {@code null}. */
    Exception exception();
}
