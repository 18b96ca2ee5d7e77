package io.agentmesh.model;

public enum AgentStatus {
    ACTIVE,
    BUSY,
    INACTIVE,
    ERROR;

    /**
     * Whether the router may still hand this agent work. Busy agents queue further messages.
     */
    public boolean routable() {
        return this == ACTIVE || this == BUSY;
    }
}
