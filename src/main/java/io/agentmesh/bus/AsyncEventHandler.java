package io.agentmesh.bus;

import java.util.concurrent.CompletionStage;

/**
 * Listener whose work finishes later. {@link EventBus#emit} waits for the returned stage
 * before moving to the next listener; {@link EventBus#emitSync} does not.
 */
@FunctionalInterface
public interface AsyncEventHandler {
    CompletionStage<?> handle(Event event) throws Exception;
}
