package fr.lapetina.inference.router.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-worker circuit breaker.
 *
 * States:
 * - CLOSED: Normal operation, requests pass through
 * - OPEN: Consecutive failures reached the threshold, requests fail fast
 * - HALF_OPEN: Recovery delay elapsed, probe requests are let through
 *
 * An open circuit never changes ring ownership; the gateway reports the failure
 * for the keys the worker owns. Thread-safe via atomic operations.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String workerId;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int successThresholdInHalfOpen;
    private final Clock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicInteger successCountInHalfOpen = new AtomicInteger(0);
    private volatile Instant lastFailureTime;
    private volatile Instant openedAt;

    public CircuitBreaker(
            String workerId,
            int failureThreshold,
            Duration recoveryTimeout,
            int successThresholdInHalfOpen,
            Clock clock
    ) {
        this.workerId = workerId;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.successThresholdInHalfOpen = successThresholdInHalfOpen;
        this.clock = clock;
    }

    public CircuitBreaker(String workerId, int failureThreshold, Duration recoveryTimeout) {
        this(workerId, failureThreshold, recoveryTimeout, 1, Clock.systemUTC());
    }

    /**
     * Checks if a request is allowed through the circuit breaker.
     *
     * @return true if request should proceed, false if circuit is open
     */
    public boolean allowRequest() {
        return switch (currentState()) {
            case CLOSED, HALF_OPEN -> true;
            case OPEN -> false;
        };
    }

    /**
     * Records a successful request.
     */
    public void recordSuccess() {
        State current = currentState();

        if (current == State.CLOSED) {
            failureCount.set(0);
            return;
        }

        if (current == State.HALF_OPEN) {
            int successes = successCountInHalfOpen.incrementAndGet();
            if (successes >= successThresholdInHalfOpen && state.compareAndSet(State.HALF_OPEN, State.CLOSED)) {
                failureCount.set(0);
                log.info("Circuit breaker CLOSED after recovery: workerId={}", workerId);
            }
        }
    }

    /**
     * Records a failed request.
     */
    public void recordFailure() {
        lastFailureTime = clock.instant();
        State current = currentState();

        if (current == State.HALF_OPEN) {
            // A failed probe reopens immediately
            if (state.compareAndSet(State.HALF_OPEN, State.OPEN)) {
                openedAt = clock.instant();
                log.warn("Circuit breaker OPENED (half-open failure): workerId={}", workerId);
            }
            return;
        }

        if (current == State.CLOSED) {
            int failures = failureCount.incrementAndGet();
            if (failures >= failureThreshold && state.compareAndSet(State.CLOSED, State.OPEN)) {
                openedAt = clock.instant();
                log.warn("Circuit breaker OPENED: workerId={}, failures={}", workerId, failures);
            }
        }
    }

    /**
     * Forces the circuit to a specific state. For admin use.
     */
    public void forceState(State newState) {
        State old = state.getAndSet(newState);
        if (newState == State.CLOSED) {
            failureCount.set(0);
        }
        if (newState == State.OPEN) {
            openedAt = clock.instant();
        }
        log.info("Circuit breaker forced from {} to {}: workerId={}", old, newState, workerId);
    }

    public State getState() {
        return currentState();
    }

    /**
     * Moves OPEN to HALF_OPEN once the recovery delay has elapsed.
     */
    private State currentState() {
        State current = state.get();
        if (current == State.OPEN && openedAt != null
                && !clock.instant().isBefore(openedAt.plus(recoveryTimeout))
                && state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
            successCountInHalfOpen.set(0);
            log.info("Circuit breaker transitioning to HALF_OPEN: workerId={}", workerId);
            return State.HALF_OPEN;
        }
        return state.get();
    }

    public int getFailureCount() {
        return failureCount.get();
    }

    public Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public String getWorkerId() {
        return workerId;
    }

    @Override
    public String toString() {
        return "CircuitBreaker{" +
                "workerId='" + workerId + '\'' +
                ", state=" + state.get() +
                ", failures=" + failureCount.get() +
                '}';
    }
}
