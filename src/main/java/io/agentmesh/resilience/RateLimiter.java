package io.agentmesh.resilience;

import io.agentmesh.config.MeshSettings;
import io.agentmesh.error.ErrorKind;
import io.agentmesh.error.MeshException;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window request counter per {@code (identifier, limitClass)}.
 *
 * <p>Requests over the window maximum are rejected and recorded as suspicious activity;
 * an identifier with more than {@code blockAfterViolations} recorded violations is blocked
 * until {@link #unblock(String)} is called.
 */
public final class RateLimiter {
    public enum LimitClass {
        GLOBAL,
        PER_AGENT,
        EXTERNAL_API
    }

    private final Map<LimitClass, Integer> maxRequests;
    private final long windowMs;
    private final int blockAfterViolations;
    private final Clock clock;
    private final Map<String, Window> windows;
    private final Map<String, Integer> suspiciousActivity;
    private final Set<String> blocked;

    public RateLimiter(MeshSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public RateLimiter(MeshSettings settings, Clock clock) {
        this.maxRequests = new EnumMap<>(LimitClass.class);
        this.maxRequests.put(LimitClass.GLOBAL, settings.rateLimitGlobal());
        this.maxRequests.put(LimitClass.PER_AGENT, settings.rateLimitPerAgent());
        this.maxRequests.put(LimitClass.EXTERNAL_API, settings.rateLimitExternalApi());
        this.windowMs = settings.rateLimitWindowMs();
        this.blockAfterViolations = settings.blockAfterViolations();
        this.clock = clock;
        this.windows = new ConcurrentHashMap<>();
        this.suspiciousActivity = new ConcurrentHashMap<>();
        this.blocked = ConcurrentHashMap.newKeySet();
    }

    /**
     * Counts one request. Returns {@code false} when the current window is exhausted.
     */
    public boolean tryAcquire(String identifier, LimitClass limitClass) {
        String key = limitClass.name() + ":" + identifier;
        long now = clock.millis();
        int max = maxRequests.get(limitClass);
        boolean[] admitted = new boolean[1];
        windows.compute(key, (k, current) -> {
            Window window = current == null || now >= current.resetAtMs()
                    ? new Window(0, now + windowMs)
                    : current;
            if (window.count() >= max) {
                admitted[0] = false;
                return window;
            }
            admitted[0] = true;
            return new Window(window.count() + 1, window.resetAtMs());
        });
        if (!admitted[0]) {
            recordSuspiciousActivity(identifier, "rate_limit_exceeded");
        }
        return admitted[0];
    }

    /**
     * Same as {@link #tryAcquire} but raises {@link ErrorKind#RATE_LIMITED} or
     * {@link ErrorKind#BLOCKED}.
     */
    public void acquire(String identifier, LimitClass limitClass) {
        if (isBlocked(identifier)) {
            throw new MeshException(
                    ErrorKind.BLOCKED,
                    "Identifier is blocked due to repeated violations: " + identifier,
                    Map.of("identifier", identifier)
            );
        }
        if (!tryAcquire(identifier, limitClass)) {
            throw new MeshException(
                    ErrorKind.RATE_LIMITED,
                    "Rate limit exceeded for " + identifier,
                    Map.of("identifier", identifier, "limit_class", limitClass.name(), "window_ms", windowMs)
            );
        }
    }

    /**
     * Counts {@code permits} requests at once, all or nothing. A rejected batch leaves the
     * window untouched and is not recorded as suspicious activity.
     *
     * @throws MeshException with {@link ErrorKind#RATE_LIMITED} when the batch does not fit
     *                       into the current window
     */
    public void admit(String identifier, LimitClass limitClass, int permits) {
        int requested = Math.max(1, permits);
        String key = limitClass.name() + ":" + identifier;
        long now = clock.millis();
        int max = maxRequests.get(limitClass);
        int[] used = new int[1];
        boolean[] admitted = new boolean[1];
        windows.compute(key, (k, current) -> {
            Window window = current == null || now >= current.resetAtMs()
                    ? new Window(0, now + windowMs)
                    : current;
            used[0] = window.count();
            if (window.count() + requested > max) {
                admitted[0] = false;
                return window;
            }
            admitted[0] = true;
            return new Window(window.count() + requested, window.resetAtMs());
        });
        if (!admitted[0]) {
            throw new MeshException(
                    ErrorKind.RATE_LIMITED,
                    "Admission of " + requested + " requests exceeds the " + limitClass.name().toLowerCase()
                            + " limit for " + identifier,
                    Map.of(
                            "identifier", identifier,
                            "limit_class", limitClass.name(),
                            "requested", requested,
                            "in_window", used[0],
                            "max", max
                    )
            );
        }
    }

    public void recordSuspiciousActivity(String identifier, String activity) {
        int previous = suspiciousActivity.merge(identifier + ":" + activity, 1, Integer::sum) - 1;
        if (previous >= blockAfterViolations) {
            blocked.add(identifier);
        }
    }

    public boolean isBlocked(String identifier) {
        return identifier != null && blocked.contains(identifier);
    }

    public boolean unblock(String identifier) {
        suspiciousActivity.keySet().removeIf(k -> k.startsWith(identifier + ":"));
        return blocked.remove(identifier);
    }

    /**
     * Drops windows that have already elapsed. Returns how many were removed.
     */
    public int purgeExpired() {
        long now = clock.millis();
        int before = windows.size();
        windows.values().removeIf(w -> now >= w.resetAtMs());
        return before - windows.size();
    }

    public Stats stats() {
        int suspicious = suspiciousActivity.values().stream().mapToInt(Integer::intValue).sum();
        return new Stats(windows.size(), blocked.size(), suspicious);
    }

    private record Window(int count, long resetAtMs) {
    }

    public record Stats(int activeWindows, int blockedIdentifiers, int suspiciousActivities) {
    }
}
