package io.agentmesh.resilience;

import io.agentmesh.error.ErrorKind;
import io.agentmesh.error.MeshException;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Closed / open / half-open breaker guarding one call site.
 *
 * <p>In half-open state exactly one trial call is admitted; concurrent callers are rejected
 * until that trial settles.
 */
public final class CircuitBreaker {
    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String name;
    private final int failureThreshold;
    private final long recoveryTimeoutMs;
    private final Clock clock;
    private State state;
    private int failureCount;
    private long nextAttemptAtMs;
    private boolean trialInFlight;

    public CircuitBreaker(String name, int failureThreshold, long recoveryTimeoutMs) {
        this(name, failureThreshold, recoveryTimeoutMs, Clock.systemUTC());
    }

    public CircuitBreaker(String name, int failureThreshold, long recoveryTimeoutMs, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeoutMs = Math.max(0L, recoveryTimeoutMs);
        this.clock = clock;
        this.state = State.CLOSED;
    }

    public <T> T execute(Callable<T> operation) throws Exception {
        boolean trial = acquire();
        try {
            T result = operation.call();
            onSuccess();
            return result;
        } catch (Exception e) {
            onFailure(trial);
            throw e;
        }
    }

    /**
     * Admits or rejects a call. Returns whether the admitted call is the half-open trial.
     * Callers that use this directly must report the outcome through {@link #onSuccess()} or
     * {@link #onFailure(boolean)}.
     */
    public synchronized boolean acquire() {
        long now = clock.millis();
        if (state == State.OPEN) {
            if (now < nextAttemptAtMs) {
                throw rejection();
            }
            state = State.HALF_OPEN;
            trialInFlight = false;
        }
        if (state == State.HALF_OPEN) {
            if (trialInFlight) {
                throw rejection();
            }
            trialInFlight = true;
            return true;
        }
        return false;
    }

    public synchronized void onSuccess() {
        failureCount = 0;
        state = State.CLOSED;
        trialInFlight = false;
    }

    public synchronized void onFailure(boolean trial) {
        failureCount++;
        if (trial || state == State.HALF_OPEN) {
            open();
            return;
        }
        if (state == State.CLOSED && failureCount >= failureThreshold) {
            open();
        }
    }

    public synchronized void reset() {
        state = State.CLOSED;
        failureCount = 0;
        nextAttemptAtMs = 0L;
        trialInFlight = false;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(
                name,
                state,
                failureCount,
                failureThreshold,
                recoveryTimeoutMs,
                nextAttemptAtMs > 0L ? Instant.ofEpochMilli(nextAttemptAtMs) : null
        );
    }

    public synchronized State state() {
        return state;
    }

    private void open() {
        state = State.OPEN;
        trialInFlight = false;
        nextAttemptAtMs = clock.millis() + recoveryTimeoutMs;
    }

    private MeshException rejection() {
        return new MeshException(
                ErrorKind.CIRCUIT_OPEN,
                "Circuit breaker " + name + " is open - service temporarily unavailable",
                Map.of("breaker", name, "next_attempt_ms", nextAttemptAtMs)
        );
    }

    public record Snapshot(
            String name,
            State state,
            int failureCount,
            int failureThreshold,
            long recoveryTimeoutMs,
            Instant nextAttemptAt
    ) {
    }
}
