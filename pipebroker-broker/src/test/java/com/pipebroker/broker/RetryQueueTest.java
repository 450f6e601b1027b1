package com.pipebroker.broker;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

final class RetryQueueTest {

  private static final Duration POLL = Duration.ofMillis(25);

  @Test
  void entryIsNotRunBeforeItsDelay() throws Exception {
    try (RetryQueue queue = new RetryQueue("t", Runnable::run, POLL)) {
      CountDownLatch ran = new CountDownLatch(1);
      AtomicLong ranAt = new AtomicLong();
      long start = System.nanoTime();

      assertTrue(queue.schedule(Duration.ofMillis(100), () -> {
        ranAt.set(System.nanoTime());
        ran.countDown();
      }, () -> fail("cancelled")));

      assertTrue(ran.await(5, TimeUnit.SECONDS));
      assertTrue(ranAt.get() - start >= TimeUnit.MILLISECONDS.toNanos(100));
      assertEquals(0, queue.pending());
    }
  }

  @Test
  void dueEntriesRunInDueTimeOrder() throws Exception {
    try (RetryQueue queue = new RetryQueue("order", Runnable::run, POLL)) {
      List<Integer> order = new CopyOnWriteArrayList<>();
      CountDownLatch all = new CountDownLatch(3);
      for (int delay : new int[] {90, 30, 60}) {
        queue.schedule(Duration.ofMillis(delay), () -> {
          order.add(delay);
          all.countDown();
        }, () -> { });
      }
      assertTrue(all.await(5, TimeUnit.SECONDS));
      assertEquals(List.of(30, 60, 90), order);
    }
  }

  @Test
  void cancelDiscardsPendingEntriesWithoutRunningThem() throws Exception {
    RetryQueue queue = new RetryQueue("cancel", Runnable::run, POLL);
    AtomicInteger ran = new AtomicInteger();
    AtomicInteger discarded = new AtomicInteger();
    for (int i = 0; i < 3; i++) {
      queue.schedule(Duration.ofSeconds(10), ran::incrementAndGet, discarded::incrementAndGet);
    }
    assertEquals(3, queue.pending());

    queue.cancel();
    TimeUnit.MILLISECONDS.sleep(100);

    assertEquals(0, ran.get());
    assertEquals(3, discarded.get());
    assertEquals(0, queue.pending());
    assertTrue(queue.isCancelled());
  }

  @Test
  void scheduleAfterCancelRunsOnCancelImmediately() {
    RetryQueue queue = new RetryQueue("late", Runnable::run, POLL);
    queue.cancel();
    AtomicInteger discarded = new AtomicInteger();

    assertFalse(queue.schedule(Duration.ZERO, () -> fail("ran"), discarded::incrementAndGet));
    assertEquals(1, discarded.get());
  }

  @Test
  void slowCallbackDoesNotDelayOtherEntries() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try (RetryQueue queue = new RetryQueue("slow", pool, POLL)) {
      CountDownLatch release = new CountDownLatch(1);
      CountDownLatch fast = new CountDownLatch(1);
      queue.schedule(Duration.ZERO, () -> {
        try {
          release.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }, () -> { });
      queue.schedule(Duration.ofMillis(20), fast::countDown, () -> { });

      assertTrue(fast.await(2, TimeUnit.SECONDS));
      release.countDown();
    } finally {
      pool.shutdownNow();
    }
  }
}
