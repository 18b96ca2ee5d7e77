package io.agentmesh.observability;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.util.Hashing;
import io.agentmesh.util.Jsons;
import io.agentmesh.util.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

final class AuditLoggerTest {
    private final AuditLogger audit = new AuditLogger("lab", MutableClock.startingAt("2026-03-01T10:00:00Z"));

    @Test
    void rowsFormAHashChain() {
        JsonNode first = Jsons.readTree(audit.log(AuditLogger.AuditEvent.of(
                "agent.register", "router", "echo", "ok", Map.of("capabilities", 2))));
        JsonNode second = Jsons.readTree(audit.log(AuditLogger.AuditEvent.of(
                "agent.unregister", "router", "echo", "ok", null)));

        Assertions.assertEquals("", first.get("prev_hash").asText());
        Assertions.assertEquals(first.get("hash").asText(), second.get("prev_hash").asText());
        Assertions.assertEquals(second.get("hash").asText(), audit.currentHash());
        Assertions.assertEquals(2L, audit.rowCount());
        Assertions.assertEquals("lab", second.get("namespace").asText());
        Assertions.assertEquals("2026-03-01T10:00:00Z", second.get("timestamp").asText());
    }

    @Test
    void hashCoversEveryOtherField() {
        JsonNode row = Jsons.readTree(audit.log(AuditLogger.AuditEvent.of(
                "workflow.submit", "workflow-coordinator", "wf_1", "accepted", Map.of("steps", 3, "name", "demo"))));

        Map<String, Object> fields = Jsons.mapper().convertValue(row, new TypeReference<LinkedHashMap<String, Object>>() {
        });
        String recorded = (String) fields.remove("hash");

        Assertions.assertEquals(Hashing.sha256Hex(Jsons.toCompactJson(fields)), recorded);
    }

    @Test
    void blankNamespaceFallsBackToDefault() {
        AuditLogger unnamed = new AuditLogger(" ");

        JsonNode row = Jsons.readTree(unnamed.log(AuditLogger.AuditEvent.of("x", "y", "z", "ok", Map.of())));

        Assertions.assertEquals("default", row.get("namespace").asText());
    }
}
