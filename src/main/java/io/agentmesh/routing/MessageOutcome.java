package io.agentmesh.routing;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.error.MeshException;

/**
 * Per-agent result of a broadcast: either a result or the error the agent produced.
 */
public record MessageOutcome(
        String agentId,
        JsonNode result,
        MeshException error
) {
    public static MessageOutcome success(String agentId, JsonNode result) {
        return new MessageOutcome(agentId, result, null);
    }

    public static MessageOutcome failure(String agentId, MeshException error) {
        return new MessageOutcome(agentId, null, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
