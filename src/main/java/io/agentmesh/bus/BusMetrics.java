package io.agentmesh.bus;

import java.time.Instant;
import java.util.Map;

public record BusMetrics(
        long totalEvents,
        long totalErrors,
        int totalListeners,
        int eventNamesWithListeners,
        double averageListenersPerEvent,
        double errorRatePercent,
        int pendingScheduled,
        Map<String, Long> eventCounts,
        Instant lastEventAt
) {
}
