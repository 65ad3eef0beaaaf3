package com.finbrain.infrastructure.ai.resilience;

import com.finbrain.domain.inference.model.GateStats;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fair admission gate bounding the number of concurrent remote calls.
 * <p>
 * Waiters are served in arrival order. Acquisition never blocks longer than the given timeout.
 * Permits are released through try-with-resources:
 * <pre>{@code
 * try (RequestGate.Permit permit = gate.acquire(timeout)) {
 *     ...
 * }
 * }</pre>
 */
@Slf4j
public class RequestGate {

    private final int capacity;
    private final Semaphore semaphore;
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger waiting = new AtomicInteger();
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong timeouts = new AtomicLong();

    public RequestGate(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        this.capacity = capacity;
        this.semaphore = new Semaphore(capacity, true);
    }

    /**
     * @throws GateTimeoutException if no permit frees up within {@code timeout} or the thread is interrupted
     */
    public Permit acquire(Duration timeout) {
        long nanos = timeout == null || timeout.isNegative() ? 0L : timeout.toNanos();
        boolean acquired;
        waiting.incrementAndGet();
        try {
            acquired = semaphore.tryAcquire(nanos, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            timeouts.incrementAndGet();
            throw new GateTimeoutException("Interrupted while waiting for a gate permit", e);
        } finally {
            waiting.decrementAndGet();
        }

        if (!acquired) {
            timeouts.incrementAndGet();
            log.warn("[RequestGate] No permit within {}ms ({} active)", timeout == null ? 0 : timeout.toMillis(),
                    active.get());
            throw new GateTimeoutException("No gate permit available within " + (nanos / 1_000_000) + "ms");
        }
        active.incrementAndGet();
        return new Permit();
    }

    public GateStats stats() {
        return new GateStats(capacity, semaphore.availablePermits(), active.get(), waiting.get(),
                processed.get(), timeouts.get());
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * One admitted slot. Closing it more than once has no further effect.
     */
    public final class Permit implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                active.decrementAndGet();
                processed.incrementAndGet();
                semaphore.release();
            }
        }

        public boolean isReleased() {
            return released.get();
        }
    }
}
