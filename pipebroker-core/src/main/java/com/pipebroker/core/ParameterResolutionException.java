package com.pipebroker.core;

import java.util.Objects;

/** A step parameter could not be resolved from any permitted source and no default was allowed. */
public final class ParameterResolutionException extends PipelineException {
    private final Class<?> parameterType;
    private final ResolveFrom resolveFrom;

    public ParameterResolutionException(Class<?> parameterType, ResolveFrom resolveFrom, String message) {
        super(message);
        this.parameterType = Objects.requireNonNull(parameterType, "parameterType");
        this.resolveFrom = Objects.requireNonNull(resolveFrom, "resolveFrom");
    }

    public Class<?> parameterType() {
        return parameterType;
    }

    public ResolveFrom resolveFrom() {
        return resolveFrom;
    }
}
