package io.agentmesh.bus;

/**
 * Names of the events the router and the workflow coordinator publish.
 */
public final class MeshEvents {
    public static final String AGENT_REGISTERED = "agent:registered";
    public static final String AGENT_UNREGISTERED = "agent:unregistered";
    public static final String AGENT_TIMEOUT = "agent:timeout";
    public static final String AGENT_RECOVERED = "agent:recovered";
    public static final String MESSAGE_DELIVERED = "message:delivered";
    public static final String MESSAGE_FAILED = "message:failed";
    public static final String WORKFLOW_STARTED = "workflow:started";
    public static final String WORKFLOW_STEP_COMPLETED = "workflow:step-completed";
    public static final String WORKFLOW_STEP_FAILED = "workflow:step-failed";
    public static final String WORKFLOW_COMPLETED = "workflow:completed";
    public static final String WORKFLOW_FAILED = "workflow:failed";

    private MeshEvents() {
    }
}
