package com.pipebroker.core;

import java.util.List;
import java.util.Objects;

/**
 * One unit of work of a {@link Pipeline}: a function plus the declaration table of its parameters. Immutable.
 */
public final class PipelineStep {
    @FunctionalInterface
    interface Invoker {
        void invoke(Object[] arguments) throws Exception;
    }

    private final String name;
    private final Invoker invoker;
    private final ParameterSpec<?>[] parameters;
    private final boolean declaresNext;
    private final boolean mayUseScope;
    private final boolean requiresScope;

    PipelineStep(String name, Invoker invoker, ParameterSpec<?>... parameters) {
        this.name = Objects.requireNonNull(name, "name");
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.parameters = parameters.clone();

        int nextCount = 0;
        boolean usesScope = false;
        boolean needsScope = false;
        for (ParameterSpec<?> parameter : this.parameters) {
            Objects.requireNonNull(parameter, "parameter");
            switch (parameter.binding()) {
                case NEXT -> nextCount++;
                case RESOLVED -> {
                    usesScope |= parameter.resolveFrom().mayUseScope();
                    needsScope |= parameter.resolveFrom().requiresScope();
                }
                default -> { }
            }
        }
        if (nextCount > 1) {
            throw new IllegalArgumentException("Step '" + name + "' declares " + nextCount + " Next parameters; at most one is allowed");
        }
        this.declaresNext = nextCount == 1;
        this.mayUseScope = usesScope;
        this.requiresScope = needsScope;
    }

    public String name() {
        return name;
    }

    public List<ParameterSpec<?>> parameters() {
        return List.of(parameters);
    }

    public boolean declaresNext() {
        return declaresNext;
    }

    ParameterSpec<?>[] parameterTable() {
        return parameters;
    }

    boolean mayUseScope() {
        return mayUseScope;
    }

    boolean requiresScope() {
        return requiresScope;
    }

    void invoke(Object[] arguments) throws Exception {
        invoker.invoke(arguments);
    }

    @Override
    public String toString() {
        return "PipelineStep(" + name + ", parameters=" + parameters.length + ")";
    }
}
