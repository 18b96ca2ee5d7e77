package io.agentmesh.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.agentmesh.util.Jsons;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Results of idempotent methods keyed by target, method and canonical arguments. Entries
 * expire after the TTL; the least recently used entry is evicted past {@code maxEntries}.
 */
public final class ResponseCache {
    private final long ttlMs;
    private final int maxEntries;
    private final LinkedHashMap<String, Entry> entries;
    private long hits;
    private long misses;

    public ResponseCache(long ttlMs, int maxEntries) {
        this.ttlMs = Math.max(0L, ttlMs);
        this.maxEntries = Math.max(1, maxEntries);
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Entry> eldest) {
                return size() > ResponseCache.this.maxEntries;
            }
        };
    }

    /**
     * Arguments are rendered with sorted object keys, so field order does not split entries.
     */
    public static String key(String agentId, String method, JsonNode args) {
        Object canonical = args == null ? null : Jsons.mapper().convertValue(args, Object.class);
        return agentId + "|" + method + "|" + Jsons.toCompactJson(canonical);
    }

    public synchronized Optional<JsonNode> get(String key, long nowMs) {
        Entry entry = entries.get(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        if (entry.expiresAtMs() <= nowMs) {
            entries.remove(key);
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.of(entry.value().deepCopy());
    }

    public synchronized void put(String key, JsonNode value, long nowMs) {
        if (ttlMs == 0L) {
            return;
        }
        entries.put(key, new Entry(value == null ? NullNode.getInstance() : value.deepCopy(), nowMs + ttlMs));
    }

    public synchronized int invalidateAgent(String agentId) {
        String prefix = agentId + "|";
        int removed = 0;
        Iterator<String> it = entries.keySet().iterator();
        while (it.hasNext()) {
            if (it.next().startsWith(prefix)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public synchronized int purgeExpired(long nowMs) {
        int removed = 0;
        Iterator<Entry> it = entries.values().iterator();
        while (it.hasNext()) {
            if (it.next().expiresAtMs() <= nowMs) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long hits() {
        return hits;
    }

    public synchronized long misses() {
        return misses;
    }

    public synchronized void clear() {
        entries.clear();
    }

    private record Entry(JsonNode value, long expiresAtMs) {
    }
}
