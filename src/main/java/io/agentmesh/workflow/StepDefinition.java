package io.agentmesh.workflow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One step of a submitted workflow. The step runs on {@code agentId} when given, otherwise on
 * the least loaded agent carrying every {@code requiredCapabilities} tag. A non-positive
 * timeout means the coordinator default.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StepDefinition(
        String id,
        String agentId,
        Set<String> requiredCapabilities,
        String operation,
        JsonNode input,
        List<String> dependencies,
        long timeoutMs,
        int retryCount
) {
    public StepDefinition {
        requiredCapabilities = requiredCapabilities == null ? Set.of() : Set.copyOf(new LinkedHashSet<>(requiredCapabilities));
        input = input == null ? NullNode.getInstance() : input;
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        retryCount = Math.max(0, retryCount);
    }

    public static StepDefinition onAgent(String id, String agentId, String operation, JsonNode input, String... dependencies) {
        return new StepDefinition(id, agentId, Set.of(), operation, input, List.of(dependencies), 0L, 0);
    }

    public static StepDefinition withCapabilities(
            String id,
            Set<String> requiredCapabilities,
            String operation,
            JsonNode input,
            String... dependencies
    ) {
        return new StepDefinition(id, null, requiredCapabilities, operation, input, List.of(dependencies), 0L, 0);
    }

    public StepDefinition withTimeout(long value) {
        return new StepDefinition(id, agentId, requiredCapabilities, operation, input, dependencies, value, retryCount);
    }

    public StepDefinition withRetries(int value) {
        return new StepDefinition(id, agentId, requiredCapabilities, operation, input, dependencies, timeoutMs, value);
    }

    boolean hasFixedAgent() {
        return agentId != null && !agentId.isBlank();
    }
}
