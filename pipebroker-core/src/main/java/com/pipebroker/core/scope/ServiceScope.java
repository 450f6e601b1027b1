package com.pipebroker.core.scope;

/**
 * A unit-of-work scope provided by the host. Instances resolved from it live until {@link #close()}.
 */
public interface ServiceScope extends AutoCloseable {

    /**
     * Returns the service registered for {@code type} (and {@code key}, when not null), or {@code null} when the host
     * has none.
     */
    <T> T resolve(Class<T> type, String key);

    @Override
    void close();
}
