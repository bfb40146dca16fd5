package com.harvey.backend.service.healing;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-dependency failure detector.
 * <p>
 * The failure count is not reset when the breaker moves to half-open, so a single
 * failure reported during the probe re-opens it.
 */
public class CircuitBreaker {

    public enum State { CLOSED, OPEN, HALF_OPEN }

    public record Snapshot(State state, int failureCount, Instant lastFailureTime, boolean available) {}

    private final int failureThreshold;
    private final Duration timeout;
    private final Clock clock;

    private int failureCount = 0;
    private Instant lastFailureTime;
    private State state = State.CLOSED;

    public CircuitBreaker(int failureThreshold, Duration timeout, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0");
        }
        this.failureThreshold = failureThreshold;
        this.timeout = timeout;
        this.clock = clock;
    }

    public synchronized void recordSuccess() {
        failureCount = 0;
        state = State.CLOSED;
    }

    public synchronized void recordFailure() {
        failureCount++;
        lastFailureTime = clock.instant();
        if (failureCount >= failureThreshold) {
            state = State.OPEN;
        }
    }

    public synchronized boolean isAvailable() {
        return switch (state) {
            case CLOSED, HALF_OPEN -> true;
            case OPEN -> {
                if (timeoutElapsed()) {
                    state = State.HALF_OPEN;
                    yield true;
                }
                yield false;
            }
        };
    }

    /**
     * Reads the breaker without moving an expired OPEN breaker to HALF_OPEN.
     */
    public synchronized Snapshot snapshot() {
        boolean available = state != State.OPEN || timeoutElapsed();
        return new Snapshot(state, failureCount, lastFailureTime, available);
    }

    public synchronized State getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public synchronized Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    private boolean timeoutElapsed() {
        return lastFailureTime != null
                && Duration.between(lastFailureTime, clock.instant()).compareTo(timeout) >= 0;
    }
}
