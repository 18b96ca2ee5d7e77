package io.agentmesh.bus;

import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * View of an {@link EventBus} that prefixes every event name with {@code prefix:} and stamps
 * emissions with the prefix as source unless one is given.
 */
public final class NamespacedEventBus {
    private final EventBus bus;
    private final String prefix;

    NamespacedEventBus(EventBus bus, String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("namespace prefix cannot be empty");
        }
        this.bus = bus;
        this.prefix = prefix.trim();
    }

    public String prefix() {
        return prefix;
    }

    public String qualify(String eventName) {
        return prefix + ":" + eventName;
    }

    public String subscribe(String eventName, EventHandler handler) {
        return bus.subscribe(qualify(eventName), handler);
    }

    public String subscribe(String eventName, EventHandler handler, SubscribeOptions options) {
        return bus.subscribe(qualify(eventName), handler, options);
    }

    public String once(String eventName, EventHandler handler) {
        return bus.once(qualify(eventName), handler);
    }

    public boolean unsubscribe(String eventName, String listenerId) {
        return bus.unsubscribe(qualify(eventName), listenerId);
    }

    public CompletableFuture<EventRecord> emit(String eventName, Object payload) {
        return emit(eventName, payload, EmitOptions.defaults());
    }

    public CompletableFuture<EventRecord> emit(String eventName, Object payload, EmitOptions options) {
        return bus.emit(qualify(eventName), payload, withSource(options));
    }

    public void emitSync(String eventName, Object payload) {
        bus.emitSync(qualify(eventName), payload, withSource(EmitOptions.defaults()));
    }

    public CompletableFuture<Event> waitFor(String eventName, long timeoutMs, Predicate<Event> filter) {
        return bus.waitFor(qualify(eventName), timeoutMs, filter);
    }

    private EmitOptions withSource(EmitOptions options) {
        EmitOptions opts = options == null ? EmitOptions.defaults() : options;
        return opts.source() == null ? opts.source(prefix) : opts;
    }
}
