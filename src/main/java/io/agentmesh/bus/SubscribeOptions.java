package io.agentmesh.bus;

import java.util.function.Predicate;

public record SubscribeOptions(
        int priority,
        boolean once,
        Predicate<Event> filter,
        String listenerId
) {
    public static SubscribeOptions defaults() {
        return new SubscribeOptions(0, false, null, null);
    }

    public static SubscribeOptions withPriority(int priority) {
        return defaults().priority(priority);
    }

    public SubscribeOptions priority(int value) {
        return new SubscribeOptions(value, once, filter, listenerId);
    }

    public SubscribeOptions once(boolean value) {
        return new SubscribeOptions(priority, value, filter, listenerId);
    }

    public SubscribeOptions filter(Predicate<Event> value) {
        return new SubscribeOptions(priority, once, value, listenerId);
    }

    public SubscribeOptions listenerId(String value) {
        return new SubscribeOptions(priority, once, filter, value);
    }
}
