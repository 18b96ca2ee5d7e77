package io.agentmesh.routing;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.model.Priority;

import java.time.Instant;

public record RoutedMessage(
        String id,
        String from,
        String to,
        String method,
        JsonNode args,
        Priority priority,
        long timeoutMs,
        int retryAttempts,
        boolean cacheable,
        Instant createdAt
) {
}
