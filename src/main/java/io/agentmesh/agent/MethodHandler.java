package io.agentmesh.agent;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One callable method of an agent. Arguments and result are JSON trees; a thrown exception is
 * reported to the caller as an execution failure of the agent.
 */
@FunctionalInterface
public interface MethodHandler {
    JsonNode handle(JsonNode args) throws Exception;
}
