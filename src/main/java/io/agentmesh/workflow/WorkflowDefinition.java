package io.agentmesh.workflow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowDefinition(
        String name,
        List<StepDefinition> steps
) {
    public WorkflowDefinition {
        name = name == null || name.isBlank() ? "workflow" : name.trim();
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static WorkflowDefinition of(String name, StepDefinition... steps) {
        return new WorkflowDefinition(name, List.of(steps));
    }
}
