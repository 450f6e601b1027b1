package com.pipebroker.core;

import com.pipebroker.core.pool.ObjectPool;
import com.pipebroker.core.pool.PooledObjectPolicy;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable bag of values flowing through one pipeline run. Holds at most one value per type, so lookups by exact type
 * are unambiguous.
 *
 * <p>Not thread-safe: a context belongs to exactly one in-flight run. Pooled instances are cleared before reuse.
 */
public final class PipelineRunContext implements RunContextView {
    private final Map<Class<?>, Object> items = new HashMap<>();
    private Exception exception;

    /** Stores {@code value} under {@code type}, replacing any previous value of that type. */
    public <T> PipelineRunContext set(Class<T> type, T value) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException(value.getClass().getName() + " is not a " + type.getName());
        }
        items.put(type, value);
        return this;
    }

    /** Stores {@code value} under its runtime class. */
    public PipelineRunContext set(Object value) {
        Objects.requireNonNull(value, "value");
        items.put(value.getClass(), value);
        return this;
    }

    public PipelineRunContext remove(Class<?> type) {
        items.remove(type);
        return this;
    }

    @Override
    public <T> T get(Class<T> type) {
        Object value = items.get(type);
        return value == null ? null : type.cast(value);
    }

    Object lookup(Class<?> type) {
        return items.get(type);
    }

    @Override
    public boolean contains(Class<?> type) {
        return items.containsKey(type);
    }

    @Override
    public int size() {
        return items.size();
    }

    @Override
    public Set<Class<?>> types() {
        return Collections.unmodifiableSet(items.keySet());
    }

    @Override
    public Exception exception() {
        return exception;
    }

    void exception(Exception failure) {
        this.exception = failure;
    }

    public void clear() {
        items.clear();
        exception = null;
    }

    /** Pool of run contexts that are cleared on release. */
    public static ObjectPool<PipelineRunContext> newPool(int max) {
        return new ObjectPool<>(max, new PooledObjectPolicy<>() {
            @Override
            public PipelineRunContext create() {
                return new PipelineRunContext();
            }

            @Override
            public boolean reset(PipelineRunContext context) {
                context.clear();
                return true;
            }
        });
    }

    /** Immutable copy, safe to read after this context has been cleared or returned to a pool. */
    public RunContextView snapshot() {
        return new Snapshot(Map.copyOf(items), exception);
    }

    @Override
    public String toString() {
        return "PipelineRunContext" + items.keySet();
    }

    private record Snapshot(Map<Class<?>, Object> items, Exception exception) implements RunContextView {
        @Override
        public <T> T get(Class<T> type) {
            Object value = items.get(type);
            return value == null ? null : type.cast(value);
        }

        @Override
        public boolean contains(Class<?> type) {
            return items.containsKey(type);
        }

        @Override
        public int size() {
            return items.size();
        }

        @Override
        public Set<Class<?>> types() {
            return items.keySet();
        }
    }
}
