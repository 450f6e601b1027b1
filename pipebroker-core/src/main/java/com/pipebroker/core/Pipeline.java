package com.pipebroker.core;

import com.pipebroker.core.pool.ObjectPool;
import com.pipebroker.core.scope.ScopeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Ordered, immutable sequence of {@link PipelineStep}s, built once and run many times. Stateless across runs, so one
 * instance may serve any number of concurrent runs as long as each run has its own {@link PipelineRunContext}.
 *
 * <p>{@code run} never throws for failures raised inside step bodies: they are captured into the returned
 * {@link PipelineRunResult}.
 */
public final class Pipeline {
    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);
    private static final ObjectPool<PipelineRunContext> RUN_CONTEXTS = PipelineRunContext.newPool(ObjectPool.defaultMax());

    private final String name;
    private final List<PipelineStep> steps;
    private final ScopeFactory scopeFactory;
    private final PipelineRunOptions options;

    private Pipeline(String name, List<PipelineStep> steps, ScopeFactory scopeFactory, PipelineRunOptions options) {
        this.name = name;
        this.steps = List.copyOf(steps);
        this.scopeFactory = scopeFactory;
        this.options = options;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() { return name; }
    public int size() { return steps.size(); }
    public List<PipelineStep> steps() { return steps; }
    public ScopeFactory scopeFactory() { return scopeFactory; }
    public PipelineRunOptions options() { return options; }

    /** Same steps, resolving external services through {@code factory}. */
    public Pipeline withScopeFactory(ScopeFactory factory) {
        return new Pipeline(name, steps, Objects.requireNonNull(factory, "factory"), options);
    }

    /** Runs with a pooled context; the result holds a snapshot of it. */
    public PipelineRunResult run() {
        return run(CancellationToken.NONE);
    }

    public PipelineRunResult run(CancellationToken cancellationToken) {
        PipelineRunContext context = RUN_CONTEXTS.acquire();
        try {
            PipelineRunResult result = execute(context, cancellationToken);
            return new PipelineRunResult(result.successful(), result.exception(), context.snapshot(),
                result.failedStepIndex(), result.failedStepName(), result.totalNanos());
        } finally {
            RUN_CONTEXTS.release(context);
        }
    }

    /** Runs with a caller-owned context; the result views that context directly. */
    public PipelineRunResult run(PipelineRunContext context) {
        return run(context, CancellationToken.NONE);
    }

    public PipelineRunResult run(PipelineRunContext context, CancellationToken cancellationToken) {
        return execute(Objects.requireNonNull(context, "context"), cancellationToken);
    }

    public CompletableFuture<PipelineRunResult> runAsync(Executor executor) {
        Objects.requireNonNull(executor, "executor");
        return CompletableFuture.supplyAsync(this::run, executor);
    }

    public CompletableFuture<PipelineRunResult> runAsync(PipelineRunContext context, CancellationToken cancellationToken, Executor executor) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(executor, "executor");
        return CompletableFuture.supplyAsync(() -> run(context, cancellationToken), executor);
    }

    private PipelineRunResult execute(PipelineRunContext context, CancellationToken cancellationToken) {
        CancellationToken token = cancellationToken == null ? CancellationToken.NONE : cancellationToken;
        long startNanos = System.nanoTime();
        PipelineRunner runner = new PipelineRunner(this, context, token);

        Exception failure = null;
        try {
            runner.runFrom(0);
        } catch (Exception exception) {
            failure = exception;
        } catch (Error error) {
            try {
                runner.close();
            } catch (RuntimeException closeException) {
                error.addSuppressed(closeException);
            }
            throw error;
        }
        try {
            runner.close();
        } catch (RuntimeException closeException) {
            if (failure == null) {
                failure = closeException;
            } else {
                failure.addSuppressed(closeException);
            }
        }

        long totalNanos = System.nanoTime() - startNanos;
        if (failure == null) {
            return PipelineRunResult.succeeded(context, totalNanos);
        }
        log.debug("pipeline '{}' failed at {}", name, runner.failedStepName(), failure);
        context.exception(failure);
        return PipelineRunResult.failed(failure, context, runner.failedIndex(), runner.failedStepName(), totalNanos);
    }

    @Override
    public String toString() {
        return "Pipeline(" + name + ", steps=" + steps.size() + ")";
    }

    public static final class Builder {
        private final String name;
        private final List<PipelineStep> steps = new ArrayList<>();
        private ScopeFactory scopeFactory;
        private PipelineRunOptions options = PipelineRunOptions.DEFAULT;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder scopeFactory(ScopeFactory factory) {
            this.scopeFactory = factory;
            return this;
        }

        public Builder options(PipelineRunOptions runOptions) {
            this.options = Objects.requireNonNull(runOptions, "runOptions");
            return this;
        }

        public Builder execute(String stepName, StepFn0 fn) {
            Objects.requireNonNull(fn, "fn");
            return add(stepName, arguments -> fn.apply());
        }

        public <A> Builder execute(String stepName, StepFn1<A> fn, ParameterSpec<A> a) {
            Objects.requireNonNull(fn, "fn");
            return add(stepName, arguments -> fn.apply(a.type().cast(arguments[0])), a);
        }

        public <A, B> Builder execute(String stepName, StepFn2<A, B> fn, ParameterSpec<A> a, ParameterSpec<B> b) {
            Objects.requireNonNull(fn, "fn");
            return add(stepName, arguments -> fn.apply(a.type().cast(arguments[0]), b.type().cast(arguments[1])), a, b);
        }

        public <A, B, C> Builder execute(String stepName, StepFn3<A, B, C> fn,
                                         ParameterSpec<A> a, ParameterSpec<B> b, ParameterSpec<C> c) {
            Objects.requireNonNull(fn, "fn");
            return add(stepName, arguments -> fn.apply(
                a.type().cast(arguments[0]), b.type().cast(arguments[1]), c.type().cast(arguments[2])), a, b, c);
        }

        public <A, B, C, D> Builder execute(String stepName, StepFn4<A, B, C, D> fn,
                                            ParameterSpec<A> a, ParameterSpec<B> b, ParameterSpec<C> c, ParameterSpec<D> d) {
            Objects.requireNonNull(fn, "fn");
            return add(stepName, arguments -> fn.apply(
                a.type().cast(arguments[0]), b.type().cast(arguments[1]),
                c.type().cast(arguments[2]), d.type().cast(arguments[3])), a, b, c, d);
        }

        public Builder execute(StepFn0 fn) { return execute(null, fn); }
        public <A> Builder execute(StepFn1<A> fn, ParameterSpec<A> a) { return execute(null, fn, a); }
        public <A, B> Builder execute(StepFn2<A, B> fn, ParameterSpec<A> a, ParameterSpec<B> b) { return execute(null, fn, a, b); }

        /** Appends the steps of an existing pipeline, keeping their names and declarations. */
        public Builder steps(Pipeline other) {
            Objects.requireNonNull(other, "other");
            steps.addAll(other.steps());
            return this;
        }

        public Pipeline build() {
            if (steps.isEmpty()) {
                throw new IllegalStateException("Pipeline '" + name + "' has no steps");
            }
            if (scopeFactory == null) {
                for (PipelineStep step : steps) {
                    if (step.requiresScope()) {
                        throw new IllegalStateException("Step '" + step.name() + "' of pipeline '" + name
                            + "' can only resolve parameters from the external scope, but no ScopeFactory is configured");
                    }
                }
            }
            return new Pipeline(name, steps, scopeFactory, options);
        }

        private Builder add(String stepName, PipelineStep.Invoker invoker, ParameterSpec<?>... parameters) {
            for (ParameterSpec<?> parameter : parameters) {
                Objects.requireNonNull(parameter, "parameter");
            }
            steps.add(new PipelineStep(formatStepName(steps.size(), stepName), invoker, parameters));
            return this;
        }

        private static String formatStepName(int idx, String labelOrNull) {
            if (labelOrNull == null || labelOrNull.isBlank()) return "s" + idx;
            return "s" + idx + ":" + labelOrNull;
        }
    }
}
