package io.agentmesh.observability;

import io.agentmesh.util.Hashing;
import io.agentmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hash-chained audit trail. Each row embeds the hash of the previous one, so a removed or
 * edited row breaks the chain. Rows are written as compact JSON to the {@code agentmesh.audit}
 * logger; where they end up is a logging configuration concern.
 */
public final class AuditLogger {
    public static final String LOGGER_NAME = "agentmesh.audit";
    private static final Logger AUDIT = LoggerFactory.getLogger(LOGGER_NAME);

    private final String namespace;
    private final Clock clock;
    private String previousHash;
    private long rowCount;

    public AuditLogger(String namespace) {
        this(namespace, Clock.systemUTC());
    }

    public AuditLogger(String namespace, Clock clock) {
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.clock = clock;
        this.previousHash = "";
    }

    /**
     * Appends a row and returns it as written.
     */
    public synchronized String log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row);
        AUDIT.info(line);
        previousHash = rowHash;
        rowCount++;
        return line;
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public synchronized long rowCount() {
        return rowCount;
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, details == null ? Map.of() : details);
        }
    }
}
