package com.finbrain.infrastructure.ai.resilience;

import com.finbrain.domain.inference.model.CircuitPhase;
import com.finbrain.domain.inference.model.CircuitSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Three-phase circuit breaker around calls to a flaky remote dependency.
 * <ul>
 *   <li>CLOSED: calls pass. {@code failureThreshold} consecutive failures within {@code failureWindow}
 *   open the circuit. A failure after the window has elapsed restarts the count.</li>
 *   <li>OPEN: calls are rejected until {@code cooldown} has passed since opening.</li>
 *   <li>HALF_OPEN: exactly one trial call is admitted; concurrent callers are rejected. Trial success
 *   closes the circuit, trial failure reopens it with a fresh cooldown.</li>
 * </ul>
 * State is guarded by a single monitor which is never held while the guarded operation runs.
 */
@Slf4j
public class CircuitBreaker {

    private enum Admission { NORMAL, TRIAL }

    private final String name;
    private final int failureThreshold;
    private final Duration failureWindow;
    private final Duration cooldown;
    private final Clock clock;

    private final Object lock = new Object();

    private CircuitPhase phase = CircuitPhase.CLOSED;
    private int consecutiveFailures;
    private Instant firstFailureAt;
    private Instant openedAt;
    private boolean trialInFlight;
    private long totalSuccesses;
    private long totalFailures;
    private long rejectedCalls;

    public CircuitBreaker(String name, int failureThreshold, Duration failureWindow, Duration cooldown, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.failureWindow = failureWindow;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    /**
     * Run {@code operation} if the circuit admits it and record the outcome. Any exception thrown by
     * the operation counts as a failure and is rethrown unchanged.
     *
     * @throws ServiceUnavailableException if the call is rejected; the operation is not invoked
     */
    public <T> T guard(Supplier<T> operation) {
        Admission admission = admit();
        boolean succeeded = false;
        try {
            T result = operation.get();
            succeeded = true;
            return result;
        } finally {
            if (succeeded) {
                onSuccess(admission);
            } else {
                onFailure(admission);
            }
        }
    }

    private Admission admit() {
        synchronized (lock) {
            switch (phase) {
                case CLOSED:
                    return Admission.NORMAL;
                case OPEN:
                    if (clock.instant().isBefore(openedAt.plus(cooldown))) {
                        break;
                    }
                    phase = CircuitPhase.HALF_OPEN;
                    trialInFlight = true;
                    log.info("[CircuitBreaker:{}] Cooldown elapsed, admitting trial", name);
                    return Admission.TRIAL;
                case HALF_OPEN:
                    if (!trialInFlight) {
                        trialInFlight = true;
                        return Admission.TRIAL;
                    }
                    break;
            }
            rejectedCalls++;
        }
        throw new ServiceUnavailableException("Circuit '" + name + "' is " + phase().name().toLowerCase());
    }

    private void onSuccess(Admission admission) {
        synchronized (lock) {
            totalSuccesses++;
            if (admission == Admission.TRIAL) {
                log.info("[CircuitBreaker:{}] Trial succeeded, closing circuit", name);
                close();
            } else if (phase == CircuitPhase.CLOSED) {
                consecutiveFailures = 0;
                firstFailureAt = null;
            }
        }
    }

    private void onFailure(Admission admission) {
        synchronized (lock) {
            totalFailures++;
            Instant now = clock.instant();
            if (admission == Admission.TRIAL) {
                log.warn("[CircuitBreaker:{}] Trial failed, reopening circuit", name);
                open(now);
                return;
            }
            if (phase != CircuitPhase.CLOSED) {
                return;
            }
            if (firstFailureAt == null || now.isAfter(firstFailureAt.plus(failureWindow))) {
                consecutiveFailures = 1;
                firstFailureAt = now;
            } else {
                consecutiveFailures++;
            }
            if (consecutiveFailures >= failureThreshold) {
                log.warn("[CircuitBreaker:{}] {} consecutive failures, opening circuit for {}s",
                        name, consecutiveFailures, cooldown.toSeconds());
                open(now);
            }
        }
    }

    private void open(Instant now) {
        phase = CircuitPhase.OPEN;
        openedAt = now;
        trialInFlight = false;
    }

    private void close() {
        phase = CircuitPhase.CLOSED;
        consecutiveFailures = 0;
        firstFailureAt = null;
        openedAt = null;
        trialInFlight = false;
    }

    /**
     * Force the circuit closed and clear the failure count.
     */
    public void reset() {
        synchronized (lock) {
            log.info("[CircuitBreaker:{}] Manual reset from {}", name, phase);
            close();
        }
    }

    public CircuitPhase phase() {
        synchronized (lock) {
            return phase;
        }
    }

    public CircuitSnapshot snapshot() {
        synchronized (lock) {
            return new CircuitSnapshot(name, phase, consecutiveFailures, openedAt,
                    totalSuccesses, totalFailures, rejectedCalls);
        }
    }

    public String getName() {
        return name;
    }
}
