package io.agentmesh.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.agentmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class ResponseCacheTest {
    @Test
    void keyIgnoresObjectFieldOrder() {
        JsonNode first = Jsons.readTree("{\"b\":1,\"a\":{\"y\":2,\"x\":3}}");
        JsonNode second = Jsons.readTree("{\"a\":{\"x\":3,\"y\":2},\"b\":1}");

        Assertions.assertEquals(
                ResponseCache.key("news", "news/list", first),
                ResponseCache.key("news", "news/list", second)
        );
        Assertions.assertNotEquals(
                ResponseCache.key("news", "news/list", first),
                ResponseCache.key("news", "news/read", first)
        );
    }

    @Test
    void entriesExpireAfterTtl() {
        ResponseCache cache = new ResponseCache(1_000L, 10);
        cache.put("k", TextNode.valueOf("v"), 0L);

        Assertions.assertEquals("v", cache.get("k", 999L).orElseThrow().asText());
        Assertions.assertTrue(cache.get("k", 1_000L).isEmpty());
        Assertions.assertEquals(1L, cache.hits());
        Assertions.assertEquals(1L, cache.misses());
        Assertions.assertEquals(0, cache.size());
    }

    @Test
    void leastRecentlyUsedEntryIsEvicted() {
        ResponseCache cache = new ResponseCache(60_000L, 2);
        cache.put("a", TextNode.valueOf("1"), 0L);
        cache.put("b", TextNode.valueOf("2"), 0L);
        cache.get("a", 1L);
        cache.put("c", TextNode.valueOf("3"), 2L);

        Assertions.assertEquals(2, cache.size());
        Assertions.assertTrue(cache.get("a", 3L).isPresent());
        Assertions.assertTrue(cache.get("b", 3L).isEmpty());
        Assertions.assertTrue(cache.get("c", 3L).isPresent());
    }

    @Test
    void cachedValuesAreCopies() {
        ResponseCache cache = new ResponseCache(60_000L, 10);
        cache.put("k", Jsons.readTree("{\"n\":1}"), 0L);

        ((com.fasterxml.jackson.databind.node.ObjectNode) cache.get("k", 1L).orElseThrow()).put("n", 2);

        Assertions.assertEquals(1, cache.get("k", 2L).orElseThrow().get("n").asInt());
    }

    @Test
    void invalidateAndPurgeRemoveMatchingEntries() {
        ResponseCache cache = new ResponseCache(1_000L, 10);
        cache.put(ResponseCache.key("echo", "tools/list", null), TextNode.valueOf("x"), 0L);
        cache.put(ResponseCache.key("echo", "resources/list", null), TextNode.valueOf("y"), 0L);
        cache.put(ResponseCache.key("other", "tools/list", null), TextNode.valueOf("z"), 500L);

        Assertions.assertEquals(2, cache.invalidateAgent("echo"));
        Assertions.assertEquals(0, cache.purgeExpired(1_000L));
        Assertions.assertEquals(1, cache.purgeExpired(1_500L));
        Assertions.assertEquals(0, cache.size());
    }

    @Test
    void zeroTtlDisablesCaching() {
        ResponseCache cache = new ResponseCache(0L, 10);
        cache.put("k", TextNode.valueOf("v"), 0L);

        Assertions.assertEquals(0, cache.size());
    }
}
