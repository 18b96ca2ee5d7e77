package io.agentmesh.resilience;

import io.agentmesh.config.MeshSettings;
import io.agentmesh.error.ErrorKind;
import io.agentmesh.error.MeshException;
import io.agentmesh.util.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class RateLimiterTest {
    private final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");

    @Test
    void windowAdmitsUpToMaximumThenResets() {
        RateLimiter limiter = limiter("{\"rateLimitPerAgent\": 2, \"rateLimitWindowMs\": 1000}");

        Assertions.assertTrue(limiter.tryAcquire("planner", RateLimiter.LimitClass.PER_AGENT));
        Assertions.assertTrue(limiter.tryAcquire("planner", RateLimiter.LimitClass.PER_AGENT));
        Assertions.assertFalse(limiter.tryAcquire("planner", RateLimiter.LimitClass.PER_AGENT));
        Assertions.assertTrue(limiter.tryAcquire("other", RateLimiter.LimitClass.PER_AGENT));

        clock.advanceMillis(1_000L);

        Assertions.assertTrue(limiter.tryAcquire("planner", RateLimiter.LimitClass.PER_AGENT));
        Assertions.assertEquals(1, limiter.stats().suspiciousActivities());
    }

    @Test
    void limitClassesCountSeparately() {
        RateLimiter limiter = limiter("{\"rateLimitPerAgent\": 1, \"rateLimitExternalApi\": 1}");

        Assertions.assertTrue(limiter.tryAcquire("planner", RateLimiter.LimitClass.PER_AGENT));
        Assertions.assertTrue(limiter.tryAcquire("planner", RateLimiter.LimitClass.EXTERNAL_API));
        Assertions.assertEquals(2, limiter.stats().activeWindows());
    }

    @Test
    void repeatedViolationsBlockUntilUnblocked() {
        RateLimiter limiter = limiter("{\"rateLimitPerAgent\": 1, \"blockAfterViolations\": 2}");
        limiter.acquire("spammer", RateLimiter.LimitClass.PER_AGENT);

        for (int i = 0; i < 3; i++) {
            MeshException limited = Assertions.assertThrows(MeshException.class,
                    () -> limiter.acquire("spammer", RateLimiter.LimitClass.PER_AGENT));
            Assertions.assertEquals(ErrorKind.RATE_LIMITED, limited.kind());
        }
        Assertions.assertTrue(limiter.isBlocked("spammer"));
        MeshException blocked = Assertions.assertThrows(MeshException.class,
                () -> limiter.acquire("spammer", RateLimiter.LimitClass.PER_AGENT));
        Assertions.assertEquals(ErrorKind.BLOCKED, blocked.kind());
        Assertions.assertFalse(blocked.retryable());
        Assertions.assertEquals(1, limiter.stats().blockedIdentifiers());

        Assertions.assertTrue(limiter.unblock("spammer"));
        Assertions.assertFalse(limiter.isBlocked("spammer"));
        Assertions.assertEquals(0, limiter.stats().suspiciousActivities());
        clock.advanceMillis(60_000L);
        limiter.acquire("spammer", RateLimiter.LimitClass.PER_AGENT);
    }

    @Test
    void admitCountsBatchesAllOrNothingWithoutBlocking() {
        RateLimiter limiter = limiter("{\"rateLimitGlobal\": 5, \"rateLimitWindowMs\": 1000, \"blockAfterViolations\": 1}");

        limiter.admit("coordinator", RateLimiter.LimitClass.GLOBAL, 3);
        for (int i = 0; i < 3; i++) {
            MeshException limited = Assertions.assertThrows(MeshException.class,
                    () -> limiter.admit("coordinator", RateLimiter.LimitClass.GLOBAL, 3));
            Assertions.assertEquals(ErrorKind.RATE_LIMITED, limited.kind());
            Assertions.assertEquals(3, limited.details().get("in_window"));
        }
        limiter.admit("coordinator", RateLimiter.LimitClass.GLOBAL, 2);

        Assertions.assertFalse(limiter.isBlocked("coordinator"));
        Assertions.assertEquals(0, limiter.stats().suspiciousActivities());
        Assertions.assertFalse(limiter.tryAcquire("coordinator", RateLimiter.LimitClass.GLOBAL));

        clock.advanceMillis(1_000L);
        limiter.admit("coordinator", RateLimiter.LimitClass.GLOBAL, 5);
    }

    @Test
    void purgeDropsOnlyElapsedWindows() {
        RateLimiter limiter = limiter("{\"rateLimitWindowMs\": 1000}");
        limiter.tryAcquire("a", RateLimiter.LimitClass.GLOBAL);
        clock.advanceMillis(600L);
        limiter.tryAcquire("b", RateLimiter.LimitClass.GLOBAL);
        clock.advanceMillis(500L);

        Assertions.assertEquals(1, limiter.purgeExpired());
        Assertions.assertEquals(1, limiter.stats().activeWindows());
    }

    private RateLimiter limiter(String json) {
        return new RateLimiter(MeshSettings.fromJson(json), clock);
    }
}
