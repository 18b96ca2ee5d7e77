package io.agentmesh.workflow;

import io.agentmesh.model.StepStatus;
import io.agentmesh.model.WorkflowStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Snapshot of a workflow run. {@code durationMs} is set once the run is terminal.
 */
public record WorkflowView(
        String id,
        String name,
        WorkflowStatus status,
        List<StepView> steps,
        Instant createdAt,
        Instant completedAt,
        Long durationMs,
        String error
) {
    public Optional<StepView> step(String stepId) {
        return steps.stream().filter(s -> s.id().equals(stepId)).findFirst();
    }

    public long countSteps(StepStatus status) {
        return steps.stream().filter(s -> s.status() == status).count();
    }
}
