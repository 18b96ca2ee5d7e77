package io.agentmesh.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentmesh.util.Jsons;

import java.time.Instant;

/**
 * Built-in agent that answers {@code echo} with the arguments it received.
 */
public final class EchoAgent {
    public static final String ID = "echo";

    private EchoAgent() {
    }

    public static AgentDescriptor descriptor() {
        return descriptor(ID);
    }

    public static AgentDescriptor descriptor(String id) {
        return AgentDescriptor.builder("Echo Agent")
                .id(id)
                .capabilities("echo", "text")
                .method("echo", args -> echo(id, args))
                .method("tools/list", args -> tools())
                .build();
    }

    private static JsonNode echo(String id, JsonNode args) {
        ObjectNode out = Jsons.object();
        out.put("agent", id);
        out.put("timestamp", Instant.now().toString());
        out.set("received", args == null ? Jsons.valueToTree(null) : args);
        return out;
    }

    private static JsonNode tools() {
        ArrayNode tools = Jsons.mapper().createArrayNode();
        tools.add("echo");
        tools.add("tools/list");
        ObjectNode out = Jsons.object();
        out.set("tools", tools);
        return out;
    }
}
