package io.agentmesh.agent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * What an agent contributes to the mesh: identity, capability tags and its method table.
 * An empty id asks the registry to generate one from the name.
 */
public record AgentDescriptor(
        String id,
        String name,
        Set<String> capabilities,
        Map<String, MethodHandler> methods
) {
    public AgentDescriptor {
        capabilities = Collections.unmodifiableSet(new LinkedHashSet<>(capabilities == null ? Set.of() : capabilities));
        methods = Collections.unmodifiableMap(new LinkedHashMap<>(methods == null ? Map.of() : methods));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public boolean supports(String method) {
        return method != null && methods.containsKey(method);
    }

    public boolean hasCapabilities(Set<String> required) {
        return required == null || capabilities.containsAll(required);
    }

    public AgentDescriptor withId(String newId) {
        return new AgentDescriptor(newId, name, capabilities, methods);
    }

    public static final class Builder {
        private final String name;
        private String id;
        private final List<String> capabilities = new ArrayList<>();
        private final Map<String, MethodHandler> methods = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder id(String value) {
            this.id = value;
            return this;
        }

        public Builder capability(String value) {
            capabilities.add(value);
            return this;
        }

        public Builder capabilities(String... values) {
            capabilities.addAll(List.of(values));
            return this;
        }

        public Builder method(String methodName, MethodHandler handler) {
            methods.put(methodName, Objects.requireNonNull(handler, "handler"));
            return this;
        }

        public AgentDescriptor build() {
            return new AgentDescriptor(id, name, new LinkedHashSet<>(capabilities), methods);
        }
    }
}
