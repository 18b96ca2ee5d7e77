package io.agentmesh.bus;

@FunctionalInterface
public interface EventErrorHook {
    void onListenerError(Throwable error, String eventName, String listenerId);
}
