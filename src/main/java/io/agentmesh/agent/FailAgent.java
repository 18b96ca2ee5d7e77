package io.agentmesh.agent;

/**
 * Built-in agent whose only method always fails. Useful to exercise failure paths.
 */
public final class FailAgent {
    public static final String ID = "fail";

    private FailAgent() {
    }

    public static AgentDescriptor descriptor() {
        return AgentDescriptor.builder("Fail Agent")
                .id(ID)
                .capability("fail")
                .method("fail", args -> {
                    throw new IllegalStateException("intentional failure from fail agent");
                })
                .build();
    }
}
