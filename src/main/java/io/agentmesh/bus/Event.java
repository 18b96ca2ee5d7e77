package io.agentmesh.bus;

import java.time.Instant;

/**
 * One emitted event. Immutable; a retried emission is a copy with a higher {@code retryCount}.
 */
public record Event(
        String name,
        Object payload,
        Instant timestamp,
        String source,
        String correlationId,
        int retryCount
) {
    Event nextRetry() {
        return new Event(name, payload, timestamp, source, correlationId, retryCount + 1);
    }
}
