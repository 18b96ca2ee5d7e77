package io.agentmesh.agent;

import io.agentmesh.model.AgentStatus;

import java.time.Instant;
import java.util.Set;

public record AgentView(
        String id,
        String name,
        Set<String> capabilities,
        Set<String> methods,
        AgentStatus status,
        int loadScore,
        Instant lastHeartbeat,
        Instant registeredAt
) {
}
