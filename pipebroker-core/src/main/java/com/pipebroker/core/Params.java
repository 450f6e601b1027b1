package com.pipebroker.core;

/** Factory methods for {@link ParameterSpec}s used when adding steps to a {@link Pipeline.Builder}. */
public final class Params {
    private Params() {}

    /** Default rule: external scope first, then the run context, default value when neither has it. */
    public static <T> ParameterSpec<T> of(Class<T> type) {
        return ParameterSpec.resolved(type, ResolveFrom.DEFAULT);
    }

    public static <T> ParameterSpec<T> of(Class<T> type, ResolveFrom resolveFrom) {
        return ParameterSpec.resolved(type, resolveFrom);
    }

    /** Run context first, external scope as fallback, default value when neither has it. */
    public static <T> ParameterSpec<T> fromContext(Class<T> type) {
        return ParameterSpec.resolved(type, ResolveFrom.context());
    }

    /** Run context only; missing value fails the step. */
    public static <T> ParameterSpec<T> requiredFromContext(Class<T> type) {
        return ParameterSpec.resolved(type, ResolveFrom.context().withFallback(false).orThrow());
    }

    public static <T> ParameterSpec<T> fromScope(Class<T> type) {
        return ParameterSpec.resolved(type, ResolveFrom.scope());
    }

    /** External scope only; missing service fails the step. */
    public static <T> ParameterSpec<T> requiredFromScope(Class<T> type) {
        return ParameterSpec.resolved(type, ResolveFrom.scope().withFallback(false).orThrow());
    }

    public static <T> ParameterSpec<T> keyed(Class<T> type, String key) {
        return ParameterSpec.resolved(type, ResolveFrom.scope().withKey(key));
    }

    public static ParameterSpec<Next> next() {
        return ParameterSpec.resolved(Next.class, ResolveFrom.DEFAULT);
    }

    public static ParameterSpec<PipelineRunContext> runContext() {
        return ParameterSpec.resolved(PipelineRunContext.class, ResolveFrom.DEFAULT);
    }

    public static ParameterSpec<CancellationToken> cancellation() {
        return ParameterSpec.resolved(CancellationToken.class, ResolveFrom.DEFAULT);
    }
}
