package com.pipebroker.core.scope;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Minimal host container: singletons shared by every scope, and scoped factories producing one instance per scope.
 * Scoped instances that are {@link AutoCloseable} are closed with their scope.
 */
public final class InMemoryScopeFactory implements ScopeFactory {
    private static final Logger log = LoggerFactory.getLogger(InMemoryScopeFactory.class);

    private final Map<ServiceKey, Object> singletons = new ConcurrentHashMap<>();
    private final Map<ServiceKey, Supplier<?>> scoped = new ConcurrentHashMap<>();

    public <T> InMemoryScopeFactory singleton(Class<T> type, T instance) {
        return singleton(type, null, instance);
    }

    public <T> InMemoryScopeFactory singleton(Class<T> type, String key, T instance) {
        singletons.put(new ServiceKey(type, key), Objects.requireNonNull(instance, "instance"));
        return this;
    }

    public <T> InMemoryScopeFactory scoped(Class<T> type, Supplier<? extends T> factory) {
        return scoped(type, null, factory);
    }

    public <T> InMemoryScopeFactory scoped(Class<T> type, String key, Supplier<? extends T> factory) {
        scoped.put(new ServiceKey(type, key), Objects.requireNonNull(factory, "factory"));
        return this;
    }

    @Override
    public ServiceScope createScope() {
        return new Scope();
    }

    private record ServiceKey(Class<?> type, String key) {
        private ServiceKey {
            type = Objects.requireNonNull(type, "type");
        }
    }

    private final class Scope implements ServiceScope {
        private final Map<ServiceKey, Object> instances = new HashMap<>();
        private final List<AutoCloseable> closeables = new ArrayList<>();
        private boolean closed;

        @Override
        public <T> T resolve(Class<T> type, String key) {
            if (closed) throw new IllegalStateException("Scope is closed");
            ServiceKey serviceKey = new ServiceKey(type, key);

            Object singleton = singletons.get(serviceKey);
            if (singleton != null) return type.cast(singleton);

            Object existing = instances.get(serviceKey);
            if (existing != null) return type.cast(existing);

            Supplier<?> factory = scoped.get(serviceKey);
            if (factory == null) return null;

            Object created = Objects.requireNonNull(factory.get(), "factory.get()");
            instances.put(serviceKey, created);
            if (created instanceof AutoCloseable closeable) {
                closeables.add(closeable);
            }
            return type.cast(created);
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            RuntimeException failure = null;
            for (int i = closeables.size() - 1; i >= 0; i--) {
                try {
                    closeables.get(i).close();
                } catch (Exception exception) {
                    log.debug("closing scoped service failed", exception);
                    if (failure == null) {
                        failure = new IllegalStateException("Failed to close scoped service", exception);
                    } else {
                        failure.addSuppressed(exception);
                    }
                }
            }
            instances.clear();
            closeables.clear();
            if (failure != null) throw failure;
        }
    }
}
