package com.pipebroker.broker;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventTranslatorOneArg;
import com.lmax.disruptor.EventTranslatorTwoArg;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.pipebroker.core.CancellationSource;
import com.pipebroker.core.CancellationToken;
import com.pipebroker.core.Pipeline;
import com.pipebroker.core.PipelineRunContext;
import com.pipebroker.core.PipelineRunResult;
import com.pipebroker.core.pool.ObjectPool;
import com.pipebroker.core.pool.PooledObjectPolicy;
import com.pipebroker.metrics.Metrics;
import com.pipebroker.metrics.MetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link EventBroker} that funnels publishes and retries through a multi-producer Disruptor ring buffer into a single
 * dispatcher. The dispatcher resolves the registrations of each event and hands each invocation to the handler pool
 * when a concurrency permit is free. Invocations that find no free permit wait in an unbounded queue that is drained
 * as running invocations finish, so the dispatcher never blocks and a handler may publish without waiting on itself.
 *
 * <p>Each invocation runs its registration's pipeline with a pooled {@link PipelineRunContext}. Failures are routed
 * to automatic retry, the registration's error hook, or the log, and never reach sibling invocations.
 */
public final class DisruptorEventBroker implements EventBroker {
    private static final Logger log = LoggerFactory.getLogger(DisruptorEventBroker.class);
    private static final long SHUTDOWN_TIMEOUT_MILLIS = 5_000;

    private static final EventTranslatorTwoArg<DispatchSlot, Object, PublishCompletion> PUBLISH =
        (slot, sequence, event, completion) -> slot.publish(event, completion);
    private static final EventTranslatorOneArg<DispatchSlot, DispatchSlot.Invocation> RETRY =
        (slot, sequence, retry) -> slot.retry(retry);

    private final String name;
    private final EventBrokerSettings settings;
    private final List<PipelineRegistry> registries;
    private final DynamicEventHandlers dynamicHandlers;
    private final ExecutorService handlerExecutor;
    private final boolean ownsExecutor;
    private final Semaphore permits;
    private final Queue<DispatchSlot.Invocation> waiting = new ConcurrentLinkedQueue<>();
    private final ObjectPool<HandlerExecutionContext> executionContexts;
    private final ObjectPool<PipelineRunContext> runContexts;
    private final ObjectPool<RetryPolicy> retryPolicies;
    private final RetryQueue retryQueue;
    private final CancellationSource cancellation = new CancellationSource();
    private final ReentrantReadWriteLock publishLock = new ReentrantReadWriteLock();
    private final Disruptor<DispatchSlot> disruptor;
    private final RingBuffer<DispatchSlot> ring;
    private volatile boolean running = true;

    private DisruptorEventBroker(Builder b) {
        this.name = b.name;
        this.settings = b.settings;
        this.dynamicHandlers = b.dynamicHandlers != null ? b.dynamicHandlers : new DynamicEventHandlers();

        List<PipelineRegistry> all = new ArrayList<>();
        all.add(StaticPipelineRegistry.of(b.registrations));
        all.addAll(b.registries);
        all.add(dynamicHandlers);
        this.registries = List.copyOf(all);

        this.ownsExecutor = b.executor == null;
        this.handlerExecutor = ownsExecutor ? Executors.newCachedThreadPool(daemonThreads("pb-handler-" + name)) : b.executor;

        int poolMax = settings.maxConcurrentHandlers();
        this.permits = new Semaphore(poolMax);
        this.executionContexts = HandlerExecutionContext.newPool(poolMax);
        this.runContexts = PipelineRunContext.newPool(poolMax);
        this.retryPolicies = new ObjectPool<>(poolMax, new PooledObjectPolicy<>() {
            @Override
            public RetryPolicy create() {
                return new RetryPolicy();
            }

            @Override
            public boolean reset(RetryPolicy policy) {
                policy.clear();
                return true;
            }
        });
        this.retryQueue = new RetryQueue(name, handlerExecutor, settings.retryPollInterval());

        this.disruptor = new Disruptor<>(DispatchSlot::new, settings.ringBufferSize(),
            DaemonThreadFactory.INSTANCE, ProducerType.MULTI, new BlockingWaitStrategy());
        disruptor.handleEventsWith(new Dispatcher());
        this.ring = disruptor.start();
        log.info("event broker '{}' started: {}", name, settings);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String name() {
        return name;
    }

    public EventBrokerSettings settings() {
        return settings;
    }

    /** Registry for handlers added and removed at runtime. */
    public DynamicEventHandlers dynamicHandlers() {
        return dynamicHandlers;
    }

    /** Retries and deferred publishes waiting for their due time. */
    public int pendingRetries() {
        return retryQueue.pending();
    }

    ObjectPool<HandlerExecutionContext> executionContextPool() {
        return executionContexts;
    }

    ObjectPool<PipelineRunContext> runContextPool() {
        return runContexts;
    }

    ObjectPool<RetryPolicy> retryPolicyPool() {
        return retryPolicies;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public CompletableFuture<Void> publish(Object event) {
        Objects.requireNonNull(event, "event");
        PublishCompletion completion = new PublishCompletion(settings.publishMode());
        publishLock.readLock().lock();
        try {
            if (!running) throw new EventBrokerPublishNotAvailableException();
            ring.publishEvent(PUBLISH, event, completion);
        } finally {
            publishLock.readLock().unlock();
        }
        return completion.future();
    }

    @Override
    public CompletableFuture<Void> publishDeferred(Object event, Duration delay) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(delay, "delay");
        if (!running) throw new EventBrokerPublishNotAvailableException();

        CompletableFuture<Void> deferred = new CompletableFuture<>();
        retryQueue.schedule(delay, () -> {
            log.debug("deferred publish of {} fired", event.getClass().getSimpleName());
            try {
                publish(event).whenComplete((ignored, failure) -> {
                    if (failure != null) deferred.completeExceptionally(failure);
                    else deferred.complete(null);
                });
            } catch (EventBrokerPublishNotAvailableException stopped) {
                deferred.completeExceptionally(new CancellationException("EventBroker stopped"));
            }
        }, () -> deferred.completeExceptionally(new CancellationException("EventBroker stopped")));
        return deferred;
    }

    @Override
    public void shutdown() {
        // cancel first so waiting invocations and due retries are dropped instead of started
        cancellation.cancel();
        publishLock.writeLock().lock();
        try {
            if (!running) return;
            running = false;
        } finally {
            publishLock.writeLock().unlock();
        }

        retryQueue.cancel();
        try {
            disruptor.shutdown(SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException timeout) {
            log.warn("event broker '{}' dispatcher did not drain in {} ms, halting", name, SHUTDOWN_TIMEOUT_MILLIS);
            disruptor.halt();
        }
        drainWaiting();
        if (ownsExecutor) {
            handlerExecutor.shutdown();
        }
        log.info("event broker '{}' stopped", name);
    }

    private List<EventRegistration<?>> registrationsFor(Class<?> eventType) {
        List<EventRegistration<?>> found = null;
        for (PipelineRegistry registry : registries) {
            List<EventRegistration<?>> registrations = registry.registrationsFor(eventType);
            if (registrations.isEmpty()) continue;
            if (found == null) {
                found = registrations;
            } else {
                List<EventRegistration<?>> merged = new ArrayList<>(found);
                merged.addAll(registrations);
                found = merged;
            }
        }
        return found == null ? List.of() : found;
    }

    private void dispatchEvent(Object event, PublishCompletion completion) {
        if (cancellation.isCancelled()) {
            completion.cancel();
            return;
        }
        Class<?> eventType = event.getClass();
        List<EventRegistration<?>> registrations = registrationsFor(eventType);
        if (registrations.isEmpty()) {
            if (!settings.disableMissingHandlerWarningLog()) {
                log.warn("no pipeline registered for event type {}", eventType.getName());
            }
            completion.dispatched();
            return;
        }
        for (EventRegistration<?> registration : registrations) {
            RetryPolicy policy = retryPolicies.acquire();
            policy.start(registration.retrySettings().maxAttempts());
            completion.chainStarted();
            schedule(new DispatchSlot.Invocation(registration, event, policy, completion));
        }
        completion.dispatched();
    }

    private void dispatchRetry(DispatchSlot.Invocation retry) {
        if (cancellation.isCancelled()) {
            endCancelled(retry.policy(), retry.completion());
            return;
        }
        retry.policy().beginRetry();
        schedule(retry);
    }

    private void schedule(DispatchSlot.Invocation invocation) {
        if (waiting.isEmpty() && permits.tryAcquire()) {
            handOff(invocation);
            return;
        }
        waiting.add(invocation);
        drainWaiting();
    }

    /**
     * Starts waiting invocations while permits are free. Runs after every enqueue and after every permit release, so
     * an invocation queued while the last permit is being returned is still picked up by one of the two sides.
     */
    private void drainWaiting() {
        while (!waiting.isEmpty()) {
            if (cancellation.isCancelled()) {
                DispatchSlot.Invocation dropped = waiting.poll();
                if (dropped != null) endCancelled(dropped.policy(), dropped.completion());
                continue;
            }
            if (!permits.tryAcquire()) return;
            DispatchSlot.Invocation next = waiting.poll();
            if (next == null) {
                permits.release();
                continue;
            }
            handOff(next);
        }
    }

    /** Starts {@code invocation} on the handler pool; the caller holds a permit for it. */
    private void handOff(DispatchSlot.Invocation invocation) {
        if (cancellation.isCancelled()) {
            permits.release();
            endCancelled(invocation.policy(), invocation.completion());
            return;
        }
        HandlerExecutionContext execution = executionContexts.acquire().init(invocation.registration(),
            invocation.event(), invocation.policy(), cancellation.token(), invocation.completion(), permits);
        try {
            handlerExecutor.execute(() -> invoke(execution));
        } catch (RejectedExecutionException rejected) {
            log.debug("handler pool rejected invocation of {}", invocation.registration(), rejected);
            execution.releasePermit();
            executionContexts.release(execution);
            endCancelled(invocation.policy(), invocation.completion());
        }
    }

    private void invoke(HandlerExecutionContext execution) {
        EventRegistration<?> registration = execution.registration();
        RetryPolicy policy = execution.retryPolicy();
        PipelineRunContext context = runContexts.acquire();
        boolean retryScheduled = false;
        try {
            context.set(execution.event());
            context.set(RetryPolicy.class, policy);
            context.set(CancellationToken.class, execution.cancellationToken());
            PipelineRunResult result = registration.pipeline().run(context, execution.cancellationToken());
            retryScheduled = complete(execution, context, result);
        } catch (RuntimeException | Error unexpected) {
            log.error("invocation of {} ended abnormally", registration, unexpected);
            execution.completion().chainFailed(new HandlerExecutionException(
                registration.eventType(), registration.pipeline().name(), unexpected));
            if (unexpected instanceof Error) throw (Error) unexpected;
        } finally {
            runContexts.release(context);
            if (!retryScheduled) retryPolicies.release(policy);
            execution.releasePermit();
            executionContexts.release(execution);
            drainWaiting();
        }
    }

    /** Routes the outcome of one attempt. @return {@code true} when the retry policy now belongs to a pending retry */
    private boolean complete(HandlerExecutionContext execution, PipelineRunContext context, PipelineRunResult result) {
        EventRegistration<?> registration = execution.registration();
        Object event = execution.event();
        RetryPolicy policy = execution.retryPolicy();
        PublishCompletion completion = execution.completion();
        CancellationToken token = execution.cancellationToken();
        String eventName = event.getClass().getSimpleName();
        String pipelineName = registration.pipeline().name();
        MetricsRecorder rec = Metrics.recorder();

        if (token.isCancellationRequested() && (!result.isSuccessful() || policy.retryRequested())) {
            log.debug("invocation of '{}' for {} cancelled", pipelineName, eventName);
            completion.cancel();
            return false;
        }

        if (result.isSuccessful()) {
            rec.onHandlerSuccess(eventName);
        } else {
            rec.onHandlerFailure(eventName, result.exception());
        }
        if (policy.retryRequested()) {
            return scheduleRetry(registration, event, policy, completion);
        }
        if (result.isSuccessful()) {
            completion.chainEnded();
            return false;
        }

        Exception failure = result.exception();
        RetrySettings retrySettings = registration.retrySettings();
        if (retrySettings.automatic()) {
            if (policy.canRetry()) {
                policy.requestRetry(retrySettings.backoff());
                return scheduleRetry(registration, event, policy, completion);
            }
            if (policy.maxAttempts() > 1) {
                rec.onRetryExhausted(eventName);
                log.warn("'{}' exhausted {} attempts handling {}", pipelineName, policy.maxAttempts(), eventName);
            }
        } else if (failure instanceof RetryExhaustedException) {
            rec.onRetryExhausted(eventName);
        }

        if (!registration.hasErrorHook()) {
            log.warn("pipeline '{}' failed handling {} at {} and has no error hook",
                pipelineName, eventName, result.failedStepName(), failure);
            completion.chainFailed(new HandlerExecutionException(event.getClass(), pipelineName, failure));
            return false;
        }

        try {
            registration.errorRoute().onError(failure, event, policy, token, context);
        } catch (RetryExhaustedException exhausted) {
            rec.onRetryExhausted(eventName);
            log.warn("error hook of '{}' requested a retry after {} of {} attempts",
                pipelineName, exhausted.attempts(), exhausted.maxAttempts());
            HandlerExecutionException error = new HandlerExecutionException(event.getClass(), pipelineName, failure);
            error.addSuppressed(exhausted);
            completion.chainFailed(error);
            return false;
        } catch (Exception hookFailure) {
            rec.onHandlerFailure(eventName, hookFailure);
            HandlerExecutionException error = new HandlerExecutionException(event.getClass(), pipelineName, hookFailure);
            error.addSuppressed(failure);
            log.error("error hook of '{}' threw while handling {}", pipelineName, eventName, error);
            completion.chainFailed(error);
            return false;
        }

        if (policy.retryRequested() && !token.isCancellationRequested()) {
            return scheduleRetry(registration, event, policy, completion);
        }
        completion.chainEnded();
        return false;
    }

    private boolean scheduleRetry(EventRegistration<?> registration, Object event, RetryPolicy policy,
                                  PublishCompletion completion) {
        Metrics.recorder().onRetryScheduled(event.getClass().getSimpleName(), policy.attempt());
        log.debug("retry {}/{} of '{}' scheduled in {}", policy.attempt(), policy.maxAttempts(),
            registration.pipeline().name(), policy.lastDelay());
        DispatchSlot.Invocation retry = new DispatchSlot.Invocation(registration, event, policy, completion);
        retryQueue.schedule(policy.lastDelay(), () -> enqueueRetry(retry), () -> endCancelled(policy, completion));
        return true;
    }

    private void enqueueRetry(DispatchSlot.Invocation retry) {
        publishLock.readLock().lock();
        try {
            if (running) {
                ring.publishEvent(RETRY, retry);
                return;
            }
        } finally {
            publishLock.readLock().unlock();
        }
        endCancelled(retry.policy(), retry.completion());
    }

    private void endCancelled(RetryPolicy policy, PublishCompletion completion) {
        retryPolicies.release(policy);
        completion.cancel();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public String toString() {
        return "DisruptorEventBroker(" + name + ", running=" + running + ")";
    }

    private final class Dispatcher implements com.lmax.disruptor.EventHandler<DispatchSlot> {
        @Override
        public void onEvent(DispatchSlot slot, long sequence, boolean endOfBatch) {
            try {
                if (slot.retry() != null) {
                    dispatchRetry(slot.retry());
                } else {
                    dispatchEvent(slot.event(), slot.completion());
                }
            } catch (RuntimeException failure) {
                log.error("event broker '{}' failed dispatching {}", name, slot, failure);
                PublishCompletion completion = slot.retry() != null ? slot.retry().completion() : slot.completion();
                if (completion != null) completion.future().completeExceptionally(failure);
            } finally {
                slot.clear();
            }
        }
    }

    public static final class Builder {
        private String name = "events";
        private EventBrokerSettings settings = EventBrokerSettings.DEFAULT;
        private final List<EventRegistration<?>> registrations = new ArrayList<>();
        private final List<PipelineRegistry> registries = new ArrayList<>();
        private DynamicEventHandlers dynamicHandlers;
        private ExecutorService executor;

        private Builder() {}

        public Builder name(String brokerName) {
            this.name = Objects.requireNonNull(brokerName, "brokerName");
            return this;
        }

        public Builder settings(EventBrokerSettings brokerSettings) {
            this.settings = Objects.requireNonNull(brokerSettings, "brokerSettings");
            return this;
        }

        public Builder register(EventRegistration<?> registration) {
            registrations.add(Objects.requireNonNull(registration, "registration"));
            return this;
        }

        public <E> Builder register(Class<E> eventType, Pipeline pipeline) {
            return register(EventRegistration.pipeline(eventType, pipeline));
        }

        public <E> Builder register(Class<E> eventType, EventHandler<E> handler) {
            return register(EventRegistration.handler(eventType, handler));
        }

        public Builder registerAll(List<? extends EventRegistration<?>> all) {
            Objects.requireNonNull(all, "all");
            all.forEach(this::register);
            return this;
        }

        /** Additional registry consulted on every dispatch, after the static registrations. */
        public Builder registry(PipelineRegistry registry) {
            registries.add(Objects.requireNonNull(registry, "registry"));
            return this;
        }

        public Builder dynamicHandlers(DynamicEventHandlers handlers) {
            this.dynamicHandlers = Objects.requireNonNull(handlers, "handlers");
            return this;
        }

        /** Handler pool; the broker does not shut down an executor it did not create. */
        public Builder executor(ExecutorService handlerExecutor) {
            this.executor = Objects.requireNonNull(handlerExecutor, "handlerExecutor");
            return this;
        }

        public DisruptorEventBroker build() {
            return new DisruptorEventBroker(this);
        }
    }
}
