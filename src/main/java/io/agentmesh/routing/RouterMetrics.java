package io.agentmesh.routing;

public record RouterMetrics(
        int totalAgents,
        int activeAgents,
        int busyAgents,
        int inactiveAgents,
        int errorAgents,
        double averageLoad,
        int queueDepth,
        long messagesRouted,
        long messagesDelivered,
        long messagesFailed,
        long timeouts,
        double averageResponseTimeMs,
        long cacheHits,
        long cacheMisses,
        int cacheEntries,
        long rejected
) {
}
