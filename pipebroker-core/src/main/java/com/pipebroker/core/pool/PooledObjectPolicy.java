package com.pipebroker.core.pool;

/**
 * Creation and reset rules for instances managed by an {@link ObjectPool}.
 */
public interface PooledObjectPolicy<T> {
    T create();

    /**
     * Clears all mutable state of {@code instance} before it becomes eligible for reuse.
     *
     * @return {@code false} to discard the instance instead of keeping it
     */
    boolean reset(T instance);
}
