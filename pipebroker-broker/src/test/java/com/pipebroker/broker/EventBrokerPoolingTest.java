package com.pipebroker.broker;

import com.pipebroker.core.CancellationToken;
import com.pipebroker.core.Params;
import com.pipebroker.core.Pipeline;
import com.pipebroker.core.pool.ObjectPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class EventBrokerPoolingTest {

  private static final int HANDLERS = 2;
  private static final int THREADS = 4;
  private static final int ROUNDS = 40;

  record Order(int id) {}
  record Audit(int id) {}

  private ExecutorService executor;

  @BeforeEach
  void startExecutor() {
    executor = Executors.newFixedThreadPool(THREADS);
  }

  @AfterEach
  void stopExecutor() throws InterruptedException {
    executor.shutdownNow();
    assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
  }

  private DisruptorEventBroker.Builder broker(PublishMode mode) {
    EventBrokerSettings settings = EventBrokerSettings.builder()
        .maxConcurrentHandlers(HANDLERS)
        .publishMode(mode)
        .retryPollInterval(Duration.ofMillis(5))
        .build();
    return DisruptorEventBroker.builder().settings(settings).executor(executor);
  }

  private static Map<String, ObjectPool<?>> pools(DisruptorEventBroker broker) {
    return Map.of(
        "execution contexts", broker.executionContextPool(),
        "run contexts", broker.runContextPool(),
        "retry policies", broker.retryPolicyPool());
  }

  private static void assertAllReturned(DisruptorEventBroker broker) throws InterruptedException {
    Map<String, ObjectPool<?>> pools = pools(broker);
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (pools.values().stream().anyMatch(p -> p.outstandingCount() != 0) && System.nanoTime() < deadline) {
      TimeUnit.MILLISECONDS.sleep(5);
    }
    pools.forEach((name, pool) -> assertEquals(0, pool.outstandingCount(), name + " still out"));
  }

  // live objects are bounded by the permits, one cached instance per thread, and a release racing the next publish
  private static void assertReused(DisruptorEventBroker broker) {
    int bound = 2 * HANDLERS + THREADS + 4;
    pools(broker).forEach((name, pool) ->
        assertTrue(pool.createdCount() <= bound, name + " created " + pool.createdCount()));
  }

  @Test
  void successfulInvocationsReturnPooledObjects() throws Exception {
    Pipeline ok = Pipeline.builder("ok").execute(() -> { }).build();
    try (DisruptorEventBroker broker = broker(PublishMode.AWAIT_COMPLETION)
        .register(Order.class, ok)
        .register(Order.class, ok)
        .build()) {
      for (int i = 0; i < ROUNDS; i++) {
        broker.publish(new Order(i)).get(5, TimeUnit.SECONDS);
      }
      assertAllReturned(broker);
      assertReused(broker);
    }
  }

  @Test
  void unhandledFailuresReturnPooledObjects() throws Exception {
    Pipeline failing = Pipeline.builder("failing").execute(() -> { throw new IllegalStateException("no"); }).build();
    try (DisruptorEventBroker broker = broker(PublishMode.AWAIT_COMPLETION).register(Order.class, failing).build()) {
      for (int i = 0; i < ROUNDS; i++) {
        int id = i;
        assertThrows(ExecutionException.class, () -> broker.publish(new Order(id)).get(5, TimeUnit.SECONDS));
      }
      assertAllReturned(broker);
      assertReused(broker);
    }
  }

  @Test
  void automaticRetriesUntilExhaustionReturnPooledObjects() throws Exception {
    Pipeline failing = Pipeline.builder("flaky").execute(() -> { throw new IllegalStateException("again"); }).build();
    Pipeline ok = Pipeline.builder("sibling").execute(() -> { }).build();
    try (DisruptorEventBroker broker = broker(PublishMode.AWAIT_COMPLETION)
        .register(EventRegistration.pipeline(Order.class, failing)
            .withRetry(RetrySettings.fixed(2, Duration.ofMillis(1)))
            .withErrorHook((ex, event, policy, token) -> { }))
        .register(Order.class, ok)
        .build()) {
      for (int i = 0; i < ROUNDS; i++) {
        broker.publish(new Order(i)).get(5, TimeUnit.SECONDS);
      }
      assertAllReturned(broker);
      assertReused(broker);
    }
  }

  @Test
  void hookRequestedRetriesAndFailingHooksReturnPooledObjects() throws Exception {
    Pipeline failing = Pipeline.builder("manual").execute(() -> { throw new IllegalArgumentException("bad"); }).build();
    Pipeline audit = Pipeline.builder("audit").execute(() -> { throw new IllegalStateException("audit"); }).build();
    try (DisruptorEventBroker broker = broker(PublishMode.AWAIT_COMPLETION)
        .register(EventRegistration.pipeline(Order.class, failing)
            .withRetry(RetrySettings.manual(2))
            .withErrorHook((ex, event, policy, token) -> policy.requestRetry(Duration.ofMillis(1))))
        .register(EventRegistration.pipeline(Audit.class, audit)
            .withErrorHook((ex, event, policy, token) -> { throw new IllegalStateException("hook"); }))
        .build()) {
      for (int i = 0; i < ROUNDS; i++) {
        int id = i;
        assertThrows(ExecutionException.class, () -> broker.publish(new Order(id)).get(5, TimeUnit.SECONDS));
        assertThrows(ExecutionException.class, () -> broker.publish(new Audit(id)).get(5, TimeUnit.SECONDS));
      }
      assertAllReturned(broker);
      assertReused(broker);
    }
  }

  @Test
  void invocationsWaitingForPermitsReturnPooledObjects() throws Exception {
    CountDownLatch handled = new CountDownLatch(ROUNDS);
    Pipeline slow = Pipeline.builder("slow").execute(() -> {
      TimeUnit.MILLISECONDS.sleep(2);
      handled.countDown();
    }).build();
    try (DisruptorEventBroker broker = broker(PublishMode.SCHEDULE).register(Order.class, slow).build()) {
      CompletableFuture<?>[] published = new CompletableFuture<?>[ROUNDS];
      for (int i = 0; i < ROUNDS; i++) published[i] = broker.publish(new Order(i));
      CompletableFuture.allOf(published).get(5, TimeUnit.SECONDS);

      assertTrue(handled.await(10, TimeUnit.SECONDS));
      assertAllReturned(broker);
    }
  }

  @Test
  void shutdownReturnsPooledObjectsOfPendingRetriesAndWaitingInvocations() throws Exception {
    Pipeline failing = Pipeline.builder("later").execute(() -> { throw new IllegalStateException("later"); }).build();
    CountDownLatch blocking = new CountDownLatch(HANDLERS);
    Pipeline untilCancelled = Pipeline.builder("until-cancelled")
        .execute((CancellationToken token) -> {
          blocking.countDown();
          while (!token.isCancellationRequested()) {
            TimeUnit.MILLISECONDS.sleep(2);
          }
        }, Params.cancellation())
        .build();

    DisruptorEventBroker broker = broker(PublishMode.SCHEDULE)
        .register(EventRegistration.pipeline(Order.class, failing).withRetry(RetrySettings.fixed(3, Duration.ofSeconds(30))))
        .register(Audit.class, untilCancelled)
        .build();

    int failures = 5;
    for (int i = 0; i < failures; i++) broker.publish(new Order(i)).get(5, TimeUnit.SECONDS);
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (broker.pendingRetries() < failures && System.nanoTime() < deadline) {
      TimeUnit.MILLISECONDS.sleep(5);
    }
    assertEquals(failures, broker.pendingRetries());

    for (int i = 0; i < HANDLERS + 4; i++) broker.publish(new Audit(i)).get(5, TimeUnit.SECONDS);
    assertTrue(blocking.await(5, TimeUnit.SECONDS));
    assertEquals(failures + HANDLERS + 4, broker.retryPolicyPool().outstandingCount());

    broker.shutdown();

    assertAllReturned(broker);
    assertEquals(0, broker.pendingRetries());
  }

  @Test
  void poolsAreSizedByConcurrency() {
    try (DisruptorEventBroker broker = broker(PublishMode.SCHEDULE).build()) {
      for (ObjectPool<?> pool : List.of(broker.executionContextPool(), broker.runContextPool(), broker.retryPolicyPool())) {
        assertEquals(HANDLERS, pool.max());
      }
    }
  }
}
