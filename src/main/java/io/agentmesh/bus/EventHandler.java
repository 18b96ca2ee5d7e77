package io.agentmesh.bus;

@FunctionalInterface
public interface EventHandler {
    void handle(Event event) throws Exception;
}
