package io.agentmesh.model;

public enum WorkflowStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean terminal() {
        return this == COMPLETED || this == FAILED;
    }
}
