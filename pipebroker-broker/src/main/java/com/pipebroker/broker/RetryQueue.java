package com.pipebroker.broker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Time-ordered holding area for deferred work, serviced by a single daemon worker.
 *
 * <p>The worker never runs callbacks itself: due entries are handed to {@code executor}, so a slow callback does not
 * delay other due entries. Each entry is either executed once or, if the queue is cancelled first, discarded and its
 * {@code onCancel} action run instead.
 */
public final class RetryQueue implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RetryQueue.class);

    private final DelayQueue<Entry> queue = new DelayQueue<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Executor executor;
    private final long pollNanos;
    private final Thread worker;
    private volatile boolean cancelled;

    public RetryQueue(String name, Executor executor, Duration pollInterval) {
        Objects.requireNonNull(name, "name");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.pollNanos = Objects.requireNonNull(pollInterval, "pollInterval").toNanos();
        if (pollNanos <= 0) throw new IllegalArgumentException("pollInterval must be > 0");
        this.worker = new Thread(this::runLoop, "pb-retry-" + name);
        this.worker.setDaemon(true);
        this.worker.start();
    }

    /**
     * Runs {@code callback} on the executor once {@code delay} has elapsed.
     *
     * @return {@code false} if the queue was already cancelled; {@code onCancel} has then run
     */
    public boolean schedule(Duration delay, Runnable callback, Runnable onCancel) {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(callback, "callback");
        Objects.requireNonNull(onCancel, "onCancel");
        Entry entry = new Entry(System.nanoTime() + Math.max(0L, delay.toNanos()), sequence.getAndIncrement(),
            callback, onCancel);
        if (cancelled) {
            entry.discard();
            return false;
        }
        queue.put(entry);
        // cancel() may have drained the queue between the check and the put
        if (cancelled && queue.remove(entry)) {
            entry.discard();
            return false;
        }
        return true;
    }

    public int pending() {
        return queue.size();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /** Stops the worker and discards every pending entry without running its callback. Idempotent. */
    public void cancel() {
        if (cancelled) return;
        cancelled = true;
        worker.interrupt();
        List<Entry> drained = new ArrayList<>();
        queue.drainTo(drained);
        // drainTo only moves expired entries
        drained.addAll(queue);
        queue.clear();
        if (!drained.isEmpty()) {
            log.debug("retry queue cancelled, discarding {} pending entries", drained.size());
        }
        for (Entry entry : drained) {
            entry.discard();
        }
    }

    @Override
    public void close() {
        cancel();
    }

    private void runLoop() {
        while (!cancelled) {
            Entry due;
            try {
                due = queue.poll(pollNanos, TimeUnit.NANOSECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            }
            if (due == null) continue;
            if (cancelled) {
                due.discard();
                break;
            }
            dispatch(due);
        }
    }

    private void dispatch(Entry entry) {
        if (!entry.claim()) return;
        try {
            executor.execute(entry.callback);
        } catch (RejectedExecutionException rejected) {
            log.warn("retry executor rejected a due entry, discarding it", rejected);
            entry.onCancel.run();
        }
    }

    private static final class Entry implements Delayed {
        private final long dueNanos;
        private final long seq;
        private final Runnable callback;
        private final Runnable onCancel;
        private final AtomicBoolean claimed = new AtomicBoolean();

        private Entry(long dueNanos, long seq, Runnable callback, Runnable onCancel) {
            this.dueNanos = dueNanos;
            this.seq = seq;
            this.callback = callback;
            this.onCancel = onCancel;
        }

        private boolean claim() {
            return claimed.compareAndSet(false, true);
        }

        private void discard() {
            if (claim()) onCancel.run();
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(dueNanos - System.nanoTime(), TimeUnit.NANOSECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            Entry that = (Entry) other;
            int byDue = Long.compare(dueNanos, that.dueNanos);
            return byDue != 0 ? byDue : Long.compare(seq, that.seq);
        }
    }
}
