package io.agentmesh.model;

public enum StepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED
}
