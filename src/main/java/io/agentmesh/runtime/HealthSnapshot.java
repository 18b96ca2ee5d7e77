package io.agentmesh.runtime;

import java.time.Instant;

/**
 * Point-in-time health of a mesh. {@code offline} counts inactive and errored agents;
 * {@code pendingEvents} counts queued router messages plus scheduled bus emissions.
 */
public record HealthSnapshot(
        Instant timestamp,
        Agents agents,
        int pendingEvents,
        int activeWorkflows,
        double averageLoad
) {
    public record Agents(int total, int active, int busy, int offline) {
    }
}
