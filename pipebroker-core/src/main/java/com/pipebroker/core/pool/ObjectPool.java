package com.pipebroker.core.pool;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded free list with a one-slot per-thread cache in front of it.
 *
 * <p>{@link #acquire()} never blocks: when both the thread slot and the shared list are empty a fresh instance is
 * created. {@link #release(Object)} resets the instance and keeps it if there is room, otherwise drops it.
 * Each acquired instance must be released at most once.
 */
public final class ObjectPool<T> {
    private final ArrayBlockingQueue<T> available;
    private final ThreadLocal<Slot<T>> local = ThreadLocal.withInitial(Slot::new);
    private final AtomicInteger createdCount = new AtomicInteger(0);
    private final AtomicInteger outstanding = new AtomicInteger(0);
    private final int max;
    private final PooledObjectPolicy<T> policy;

    public ObjectPool(int max, PooledObjectPolicy<T> policy) {
        if (max < 1) throw new IllegalArgumentException("max must be >= 1");
        this.max = max;
        this.policy = Objects.requireNonNull(policy, "policy");
        this.available = new ArrayBlockingQueue<>(max);
    }

    public int max() {
        return max;
    }

    /** Number of instances this pool has allocated so far. */
    public int createdCount() {
        return createdCount.get();
    }

    /** Instances acquired and not yet released. */
    public int outstandingCount() {
        return outstanding.get();
    }

    public T acquire() {
        outstanding.incrementAndGet();
        Slot<T> slot = local.get();
        T cached = slot.value;
        if (cached != null) {
            slot.value = null;
            return cached;
        }

        T fromQueue = available.poll();
        if (fromQueue != null) {
            return fromQueue;
        }

        createdCount.incrementAndGet();
        return Objects.requireNonNull(policy.create(), "policy.create()");
    }

    public void release(T instance) {
        if (instance == null) return;
        outstanding.decrementAndGet();
        if (!policy.reset(instance)) return;

        Slot<T> slot = local.get();
        if (slot.value == null) {
            slot.value = instance;
            return;
        }
        available.offer(instance);
    }

    /** Default capacity used when a caller does not size a pool explicitly. */
    public static int defaultMax() {
        int processors = Runtime.getRuntime().availableProcessors();
        int computed = processors * 8;
        return Math.min(256, Math.max(1, computed));
    }

    private static final class Slot<T> {
        private T value;
    }
}
