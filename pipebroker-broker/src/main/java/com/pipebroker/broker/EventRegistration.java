package com.pipebroker.broker;

import com.pipebroker.core.CancellationToken;
import com.pipebroker.core.Params;
import com.pipebroker.core.Pipeline;
import com.pipebroker.core.PipelineRunContext;
import com.pipebroker.core.RunContextView;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Binds a pipeline to an event type, with its retry settings and optional error hook. Immutable.
 *
 * <p>Every run started for the registration finds in its {@link PipelineRunContext} the event (under its runtime
 * class), the {@link RetryPolicy} and the {@link CancellationToken}.
 */
public final class EventRegistration<E> {
    @FunctionalInterface
    interface ErrorRoute {
        void onError(Exception exception, Object event, RetryPolicy retryPolicy, CancellationToken token,
                     RunContextView context) throws Exception;
    }

    private final Class<E> eventType;
    private final Pipeline pipeline;
    private final RetrySettings retrySettings;
    private final ErrorRoute errorRoute;

    private EventRegistration(Class<E> eventType, Pipeline pipeline, RetrySettings retrySettings, ErrorRoute errorRoute) {
        this.eventType = Objects.requireNonNull(eventType, "eventType");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.retrySettings = Objects.requireNonNull(retrySettings, "retrySettings");
        this.errorRoute = errorRoute;
    }

    /** Runs {@code pipeline} for every {@code eventType} event; no retries, no error hook. */
    public static <E> EventRegistration<E> pipeline(Class<E> eventType, Pipeline pipeline) {
        return new EventRegistration<>(eventType, pipeline, RetrySettings.none(), null);
    }

    public static <E> EventRegistration<E> handler(Class<E> eventType, EventHandler<E> handler) {
        Objects.requireNonNull(handler, "handler");
        return handler(eventType, () -> handler, null);
    }

    public static <E> EventRegistration<E> handler(Class<E> eventType, Supplier<? extends EventHandler<E>> factory) {
        return handler(eventType, factory, null);
    }

    /**
     * Handler registration whose handler step is preceded by the steps of {@code middleware}. Middleware steps that
     * declare {@code Next} decide whether the handler runs.
     */
    public static <E> EventRegistration<E> handler(Class<E> eventType, Supplier<? extends EventHandler<E>> factory,
                                                   Pipeline middleware) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(factory, "factory");

        Pipeline.Builder builder = Pipeline.builder(eventType.getSimpleName() + "Handler");
        if (middleware != null) {
            builder.steps(middleware);
            if (middleware.scopeFactory() != null) builder.scopeFactory(middleware.scopeFactory());
        }
        Pipeline pipeline = builder
            .execute("handle", (PipelineRunContext context, RetryPolicy policy, CancellationToken token) -> {
                EventHandler<E> handler = Objects.requireNonNull(factory.get(), "handler factory returned null");
                context.set(EventHandler.class, handler);
                handler.handle(context.get(eventType), policy, token);
            }, Params.runContext(), Params.requiredFromContext(RetryPolicy.class), Params.cancellation())
            .build();

        ErrorRoute route = (exception, event, policy, token, context) -> {
            EventHandler<E> handler = handlerOf(context);
            if (handler == null) {
                handler = Objects.requireNonNull(factory.get(), "handler factory returned null");
            }
            handler.onError(exception, eventType.cast(event), policy, token);
        };
        return new EventRegistration<>(eventType, pipeline, RetrySettings.none(), route);
    }

    public EventRegistration<E> withRetry(RetrySettings settings) {
        return new EventRegistration<>(eventType, pipeline, settings, errorRoute);
    }

    /** Replaces the error hook; for handler registrations this replaces {@link EventHandler#onError}. */
    public EventRegistration<E> withErrorHook(ErrorHook<? super E> hook) {
        Objects.requireNonNull(hook, "hook");
        return new EventRegistration<>(eventType, pipeline, retrySettings,
            (exception, event, policy, token, context) -> hook.onError(exception, eventType.cast(event), policy, token));
    }

    public Class<E> eventType() {
        return eventType;
    }

    public Pipeline pipeline() {
        return pipeline;
    }

    public RetrySettings retrySettings() {
        return retrySettings;
    }

    public boolean hasErrorHook() {
        return errorRoute != null;
    }

    ErrorRoute errorRoute() {
        return errorRoute;
    }

    @SuppressWarnings("unchecked")
    private static <E> EventHandler<E> handlerOf(RunContextView context) {
        return (EventHandler<E>) context.get(EventHandler.class);
    }

    @Override
    public String toString() {
        return "EventRegistration(" + eventType.getSimpleName() + " -> " + pipeline.name() + ", " + retrySettings + ")";
    }
}
