package com.pipebroker.core;

import com.pipebroker.core.scope.ServiceScope;

import java.util.Objects;

/**
 * Resolves a declared step parameter against the run context and the external scope by exact type.
 *
 * <p>Invoked once per parameter per step execution; nothing is cached across runs.
 */
public final class ParameterResolver {
    private ParameterResolver() {}

    /**
     * @param scope the scope of the current step, or {@code null} when the pipeline has no scope factory
     * @throws ParameterResolutionException when no permitted source has a value and the rule says to throw
     */
    public static Object resolve(ParameterSpec<?> parameter, PipelineRunContext context, ServiceScope scope) {
        Objects.requireNonNull(parameter, "parameter");
        Objects.requireNonNull(context, "context");

        ResolveFrom rule = parameter.resolveFrom();
        Class<?> type = parameter.type();
        Object value = switch (rule.primarySource()) {
            case RUN_CONTEXT -> {
                Object fromContext = context.lookup(type);
                yield fromContext == null && rule.allowFallback() ? fromScope(type, rule, scope) : fromContext;
            }
            case EXTERNAL_SCOPE -> {
                Object fromScope = fromScope(type, rule, scope);
                yield fromScope == null && rule.allowFallback() ? context.lookup(type) : fromScope;
            }
        };

        if (value != null) return value;

        return switch (rule.notFound()) {
            case USE_DEFAULT -> parameter.defaultValue();
            case THROW_EXCEPTION -> throw notFound(type, rule, scope);
        };
    }

    private static Object fromScope(Class<?> type, ResolveFrom rule, ServiceScope scope) {
        if (scope == null) return null;
        return scope.resolve(type, rule.key());
    }

    private static ParameterResolutionException notFound(Class<?> type, ResolveFrom rule, ServiceScope scope) {
        String searched;
        if (!rule.allowFallback()) {
            searched = rule.primarySource() == Source.RUN_CONTEXT ? "run context" : "external scope";
        } else {
            searched = "run context or external scope";
        }
        String withKey = rule.key() == null ? "" : " with key " + rule.key();
        String noScope = scope == null && rule.mayUseScope() ? " (no external scope available)" : "";
        return new ParameterResolutionException(type, rule,
            "No " + type.getName() + withKey + " found in " + searched + noScope + ". " + rule);
    }
}
