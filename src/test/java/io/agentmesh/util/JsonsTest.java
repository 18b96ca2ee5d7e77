package io.agentmesh.util;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

final class JsonsTest {

    @Test
    void compactJsonSortsKeysSoEqualMapsRenderIdentically() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("b", 2);
        a.put("a", 1);
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("a", 1);
        b.put("b", 2);

        Assertions.assertEquals(Jsons.toCompactJson(a), Jsons.toCompactJson(b));
        Assertions.assertEquals("{\"a\":1,\"b\":2}", Jsons.toCompactJson(a));
    }

    @Test
    void readTreeTreatsBlankAsNullAndRejectsGarbage() {
        JsonNode blank = Jsons.readTree("  ");
        Assertions.assertTrue(blank.isNull());
        Assertions.assertThrows(IllegalArgumentException.class, () -> Jsons.readTree("{not json"));
    }
}
