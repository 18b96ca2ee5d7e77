package io.agentmesh.resilience;

import io.agentmesh.error.ErrorKind;
import io.agentmesh.error.MeshException;
import io.agentmesh.util.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class CircuitBreakerTest {
    private final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    private final CircuitBreaker breaker = new CircuitBreaker("agent:worker", 3, 1_000L, clock);

    @Test
    void opensAfterThresholdAndRejectsWithoutCalling() {
        failTimes(3);

        Assertions.assertEquals(CircuitBreaker.State.OPEN, breaker.state());
        MeshException error = Assertions.assertThrows(MeshException.class, () -> breaker.execute(() -> {
            Assertions.fail("operation must not run while open");
            return null;
        }));
        Assertions.assertEquals(ErrorKind.CIRCUIT_OPEN, error.kind());
        Assertions.assertTrue(error.retryable());
        Assertions.assertEquals(3, breaker.snapshot().failureCount());
        Assertions.assertNotNull(breaker.snapshot().nextAttemptAt());
    }

    @Test
    void successBelowThresholdResetsFailureCount() throws Exception {
        failTimes(2);
        breaker.execute(() -> "fine");
        failTimes(2);

        Assertions.assertEquals(CircuitBreaker.State.CLOSED, breaker.state());
        Assertions.assertEquals(2, breaker.snapshot().failureCount());
    }

    @Test
    void halfOpenAdmitsExactlyOneTrial() {
        failTimes(3);
        clock.advanceMillis(1_000L);

        boolean trial = breaker.acquire();

        Assertions.assertTrue(trial);
        Assertions.assertEquals(CircuitBreaker.State.HALF_OPEN, breaker.state());
        MeshException second = Assertions.assertThrows(MeshException.class, breaker::acquire);
        Assertions.assertEquals(ErrorKind.CIRCUIT_OPEN, second.kind());
    }

    @Test
    void successfulTrialClosesBreaker() throws Exception {
        failTimes(3);
        clock.advanceMillis(1_500L);

        Assertions.assertEquals("recovered", breaker.execute(() -> "recovered"));

        Assertions.assertEquals(CircuitBreaker.State.CLOSED, breaker.state());
        Assertions.assertEquals(0, breaker.snapshot().failureCount());
    }

    @Test
    void failedTrialReopensForAnotherRecoveryPeriod() {
        failTimes(3);
        clock.advanceMillis(1_000L);
        failTimes(1);

        Assertions.assertEquals(CircuitBreaker.State.OPEN, breaker.state());
        Assertions.assertThrows(MeshException.class, breaker::acquire);
        clock.advanceMillis(999L);
        Assertions.assertThrows(MeshException.class, breaker::acquire);
        clock.advanceMillis(1L);
        Assertions.assertTrue(breaker.acquire());
    }

    @Test
    void resetClosesImmediately() {
        failTimes(3);

        breaker.reset();

        Assertions.assertEquals(CircuitBreaker.State.CLOSED, breaker.state());
        Assertions.assertFalse(breaker.acquire());
        Assertions.assertNull(breaker.snapshot().nextAttemptAt());
    }

    @Test
    void thresholdBelowOneIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new CircuitBreaker("x", 0, 10L));
    }

    private void failTimes(int count) {
        for (int i = 0; i < count; i++) {
            Assertions.assertThrows(IllegalStateException.class, () -> breaker.execute(() -> {
                throw new IllegalStateException("down");
            }));
        }
    }
}
