package io.agentmesh.routing;

import io.agentmesh.model.Priority;

/**
 * Per-message routing options. A non-positive timeout means the router default.
 */
public record SendOptions(
        Priority priority,
        long timeoutMs,
        int retryAttempts,
        boolean cacheable
) {
    public SendOptions {
        priority = priority == null ? Priority.NORMAL : priority;
        if (retryAttempts < 0) {
            throw new IllegalArgumentException("retryAttempts must be >= 0");
        }
    }

    public static SendOptions defaults() {
        return new SendOptions(Priority.NORMAL, 0L, 0, true);
    }

    public SendOptions priority(Priority value) {
        return new SendOptions(value, timeoutMs, retryAttempts, cacheable);
    }

    public SendOptions timeoutMs(long value) {
        return new SendOptions(priority, value, retryAttempts, cacheable);
    }

    public SendOptions retryAttempts(int value) {
        return new SendOptions(priority, timeoutMs, value, cacheable);
    }

    public SendOptions cacheable(boolean value) {
        return new SendOptions(priority, timeoutMs, retryAttempts, value);
    }
}
