package com.pipebroker.core;

import java.util.Objects;

/**
 * Resolution rule for one step parameter.
 *
 * <p>The primary source is consulted first. When it has no value and {@code allowFallback} is set, the other
 * source is consulted. {@code notFound} applies only when neither permitted source produced a value.
 * {@code key} selects a named service in the external scope and is ignored for the run context.
 */
public record ResolveFrom(Source primarySource, boolean allowFallback, NotFoundBehavior notFound, String key) {
    public static final ResolveFrom DEFAULT =
        new ResolveFrom(Source.EXTERNAL_SCOPE, true, NotFoundBehavior.USE_DEFAULT, null);

    public ResolveFrom {
        primarySource = Objects.requireNonNull(primarySource, "primarySource");
        notFound = Objects.requireNonNull(notFound, "notFound");
    }

    public static ResolveFrom context() {
        return new ResolveFrom(Source.RUN_CONTEXT, true, NotFoundBehavior.USE_DEFAULT, null);
    }

    public static ResolveFrom scope() {
        return DEFAULT;
    }

    public ResolveFrom withFallback(boolean fallback) {
        return new ResolveFrom(primarySource, fallback, notFound, key);
    }

    public ResolveFrom orThrow() {
        return new ResolveFrom(primarySource, allowFallback, NotFoundBehavior.THROW_EXCEPTION, key);
    }

    public ResolveFrom withKey(String serviceKey) {
        return new ResolveFrom(primarySource, allowFallback, notFound, serviceKey);
    }

    /** True when a value can only come from the external scope and its absence is an error. */
    boolean requiresScope() {
        return primarySource == Source.EXTERNAL_SCOPE && !allowFallback && notFound == NotFoundBehavior.THROW_EXCEPTION;
    }

    /** True when the external scope may be consulted at all. */
    boolean mayUseScope() {
        return primarySource == Source.EXTERNAL_SCOPE || allowFallback;
    }

    @Override
    public String toString() {
        return "ResolveFrom { primarySource = " + primarySource
            + ", allowFallback = " + allowFallback
            + ", notFound = " + notFound
            + ", key = " + key + " }";
    }
}
