package io.agentmesh.bus;

import java.util.List;

/**
 * History entry for one dispatch of an event.
 */
public record EventRecord(
        Event event,
        int listenersNotified,
        List<ListenerError> errors
) {
    public EventRecord {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean failed() {
        return !errors.isEmpty();
    }

    public record ListenerError(String listenerId, String errorType, String message) {
    }
}
