package com.pipebroker.config;

import com.pipebroker.broker.EventHandler;

import java.lang.reflect.Constructor;
import java.util.Objects;
import java.util.function.Supplier;

/** Creates a new handler per attempt through the handler class's no-arg constructor. */
final class ReflectiveHandlerFactory<E> implements Supplier<EventHandler<E>> {
    private final Constructor<?> constructor;
    private final String handlerReference;

    ReflectiveHandlerFactory(Constructor<?> constructor, String handlerReference) {
        this.constructor = Objects.requireNonNull(constructor, "constructor");
        this.handlerReference = Objects.requireNonNull(handlerReference, "handlerReference");
    }

    @Override
    @SuppressWarnings("unchecked")
    public EventHandler<E> get() {
        try {
            return (EventHandler<E>) constructor.newInstance();
        } catch (Exception exception) {
            throw new IllegalStateException("Failed to instantiate handler: " + handlerReference, exception);
        }
    }
}
