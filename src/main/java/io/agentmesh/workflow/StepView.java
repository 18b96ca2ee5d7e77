package io.agentmesh.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.model.StepStatus;

import java.time.Instant;
import java.util.List;

public record StepView(
        String id,
        String agentId,
        String operation,
        List<String> dependencies,
        StepStatus status,
        JsonNode result,
        String error,
        String errorKind,
        Instant startedAt,
        Instant completedAt
) {
}
