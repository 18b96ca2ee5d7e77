package io.agentmesh.resilience;

import io.agentmesh.error.MeshException;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Retry-with-backoff for operations that fail with a retryable {@link MeshException}.
 *
 * <p>{@code maxAttempts} counts retries after the first call, so an operation runs at most
 * {@code maxAttempts + 1} times. Non-retryable errors and the error of the final attempt are
 * rethrown as raised; anything that is not a {@link MeshException} is wrapped as a
 * non-retryable execution error. The error's attempt counter holds the number of failed calls.
 */
public final class Retry {
    public static final List<Long> DEFAULT_DELAYS_MS = List.of(1_000L, 2_000L, 4_000L, 8_000L);

    private final Sleeper sleeper;

    public Retry() {
        this(Thread::sleep);
    }

    public Retry(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public <T> T withRetry(Callable<T> operation, int maxAttempts) {
        return withRetry(operation, maxAttempts, null);
    }

    public <T> T withRetry(Callable<T> operation, int maxAttempts, List<Long> delaysMs) {
        int retries = Math.max(0, maxAttempts);
        List<Long> delays = delaysMs == null ? DEFAULT_DELAYS_MS : delaysMs;
        MeshException last = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            MeshException failure;
            try {
                return operation.call();
            } catch (Exception e) {
                failure = MeshException.from(e);
            }
            while (failure.attempt() < attempt + 1) {
                failure.incrementAttempt();
            }
            last = failure;
            if (!failure.retryable() || attempt == retries) {
                throw failure;
            }
            long delay = delayFor(delays, attempt);
            if (delay > 0L) {
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw failure;
                }
            }
        }
        throw last;
    }

    /**
     * Exponential schedule {@code base, 2*base, 4*base, ...} of the given length.
     */
    public static List<Long> exponentialDelays(long baseDelayMs, int count) {
        Long[] delays = new Long[Math.max(0, count)];
        for (int i = 0; i < delays.length; i++) {
            delays[i] = Math.max(0L, baseDelayMs) << Math.min(i, 20);
        }
        return List.of(delays);
    }

    private static long delayFor(List<Long> delays, int attempt) {
        if (delays.isEmpty()) {
            return 0L;
        }
        Long value = attempt < delays.size() ? delays.get(attempt) : delays.get(delays.size() - 1);
        return value == null ? 0L : value;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
