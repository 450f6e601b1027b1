package com.pipebroker.core;

import com.pipebroker.core.scope.ScopeFactory;
import com.pipebroker.core.scope.ServiceScope;
import com.pipebroker.metrics.Metrics;
import com.pipebroker.metrics.MetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CancellationException;

/** Executes the steps of one pipeline run. One instance per run; not thread-safe. */
final class PipelineRunner {
    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    private final Pipeline pipeline;
    private final List<PipelineStep> steps;
    private final PipelineRunContext context;
    private final CancellationToken cancellationToken;
    private final MetricsRecorder rec;

    private ServiceScope runScope;
    private Exception lastFailure;
    private int failedIndex = -1;

    PipelineRunner(Pipeline pipeline, PipelineRunContext context, CancellationToken cancellationToken) {
        this.pipeline = pipeline;
        this.steps = pipeline.steps();
        this.context = context;
        this.cancellationToken = cancellationToken;
        this.rec = Metrics.recorder();
    }

    void runFrom(int index) throws Exception {
        for (int i = index; i < steps.size(); i++) {
            PipelineStep step = steps.get(i);
            if (cancellationToken.isCancellationRequested()) {
                CancellationException cancelled =
                    new CancellationException("Pipeline '" + pipeline.name() + "' cancelled before " + step.name());
                lastFailure = cancelled;
                failedIndex = i;
                throw cancelled;
            }
            if (step.declaresNext()) {
                Continuation next = new Continuation(i + 1);
                invoke(step, i, next);
                if (!next.invoked && i + 1 < steps.size()) {
                    rec.onShortCircuit(pipeline.name(), step.name());
                    log.debug("short-circuit '{}' at {}: next not invoked", pipeline.name(), step.name());
                }
                return;
            }
            invoke(step, i, null);
        }
    }

    int failedIndex() {
        return failedIndex;
    }

    String failedStepName() {
        return failedIndex < 0 ? null : steps.get(failedIndex).name();
    }

    /** Closes the run-wide scope, if one was opened. */
    void close() {
        if (runScope != null) {
            ServiceScope scope = runScope;
            runScope = null;
            scope.close();
        }
    }

    private void invoke(PipelineStep step, int index, Continuation next) throws Exception {
        ServiceScope scope = null;
        boolean ownsScope = false;
        ScopeFactory scopeFactory = pipeline.scopeFactory();
        if (step.mayUseScope() && scopeFactory != null) {
            if (pipeline.options().scopePerStep()) {
                scope = scopeFactory.createScope();
                ownsScope = true;
            } else {
                if (runScope == null) runScope = scopeFactory.createScope();
                scope = runScope;
            }
        }

        long startNanos = System.nanoTime();
        Exception stepException = null;
        try {
            step.invoke(bind(step, next, scope));
            rec.onStepSuccess(pipeline.name(), step.name(), System.nanoTime() - startNanos);
        } catch (Exception exception) {
            stepException = exception;
            if (exception != lastFailure) {
                lastFailure = exception;
                failedIndex = index;
                rec.onStepError(pipeline.name(), step.name(), exception);
            }
            throw exception;
        } finally {
            if (ownsScope) {
                try {
                    scope.close();
                } catch (RuntimeException closeException) {
                    if (stepException != null) {
                        stepException.addSuppressed(closeException);
                    } else {
                        throw closeException;
                    }
                }
            }
        }
    }

    private Object[] bind(PipelineStep step, Continuation next, ServiceScope scope) {
        ParameterSpec<?>[] parameters = step.parameterTable();
        Object[] arguments = new Object[parameters.length];
        for (int i = 0; i < parameters.length; i++) {
            ParameterSpec<?> parameter = parameters[i];
            arguments[i] = switch (parameter.binding()) {
                case NEXT -> next;
                case RUN_CONTEXT -> context;
                case CANCELLATION -> cancellationToken;
                case RESOLVED -> ParameterResolver.resolve(parameter, context, scope);
            };
        }
        return arguments;
    }

    private final class Continuation implements Next {
        private final int nextIndex;
        private boolean invoked;

        private Continuation(int nextIndex) {
            this.nextIndex = nextIndex;
        }

        @Override
        public void run() throws Exception {
            if (invoked) {
                throw new IllegalStateException("next already invoked by step " + steps.get(nextIndex - 1).name());
            }
            invoked = true;
            runFrom(nextIndex);
        }
    }
}
