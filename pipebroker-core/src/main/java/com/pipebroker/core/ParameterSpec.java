package com.pipebroker.core;

import java.util.Objects;

/**
 * Declaration of one step parameter: its type, how it is bound, and the value used when resolution falls back to a
 * default. Built once per step, when the pipeline is assembled.
 */
public record ParameterSpec<T>(Class<T> type, Binding binding, ResolveFrom resolveFrom, T defaultValue) {

    public enum Binding {
        RESOLVED,
        NEXT,
        RUN_CONTEXT,
        CANCELLATION
    }

    public ParameterSpec {
        type = Objects.requireNonNull(type, "type");
        binding = Objects.requireNonNull(binding, "binding");
        resolveFrom = Objects.requireNonNull(resolveFrom, "resolveFrom");
        if (defaultValue != null && !type.isInstance(defaultValue)) {
            throw new IllegalArgumentException("Default value " + defaultValue + " is not a " + type.getName());
        }
    }

    static <T> ParameterSpec<T> resolved(Class<T> type, ResolveFrom resolveFrom) {
        Objects.requireNonNull(type, "type");
        Binding special = specialBinding(type);
        return new ParameterSpec<>(type, special == null ? Binding.RESOLVED : special, resolveFrom, null);
    }

    public ParameterSpec<T> orDefault(T value) {
        if (binding != Binding.RESOLVED) {
            throw new IllegalStateException("Only resolved parameters take a default value: " + type.getName());
        }
        return new ParameterSpec<>(type, binding, resolveFrom.notFound() == NotFoundBehavior.USE_DEFAULT
            ? resolveFrom
            : new ResolveFrom(resolveFrom.primarySource(), resolveFrom.allowFallback(), NotFoundBehavior.USE_DEFAULT,
                resolveFrom.key()), value);
    }

    private static Binding specialBinding(Class<?> type) {
        if (type == Next.class) return Binding.NEXT;
        if (type == PipelineRunContext.class) return Binding.RUN_CONTEXT;
        if (type == CancellationToken.class) return Binding.CANCELLATION;
        return null;
    }
}
