package io.agentmesh.observability;

import io.agentmesh.bus.BusMetrics;
import io.agentmesh.resilience.RateLimiter;
import io.agentmesh.routing.RouterMetrics;
import io.agentmesh.runtime.HealthSnapshot;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

final class PrometheusFormatterTest {
    private final RouterMetrics router = new RouterMetrics(3, 1, 1, 1, 0, 0.5, 2, 10L, 8L, 1L, 1L, 12.25, 4L, 3L, 2, 0L);
    private final HealthSnapshot health = new HealthSnapshot(
            Instant.parse("2026-01-01T00:00:00Z"),
            new HealthSnapshot.Agents(3, 1, 1, 1),
            2,
            1,
            0.5
    );
    private final RateLimiter.Stats limiter = new RateLimiter.Stats(4, 0, 1);

    @Test
    void rendersGaugesWithSingleHelpHeaderPerMetric() {
        String text = PrometheusFormatter.format(router, bus(), health, limiter);

        Assertions.assertTrue(text.contains("agentmesh_agents{status=\"active\"} 1\n"));
        Assertions.assertTrue(text.contains("agentmesh_messages_total{outcome=\"delivered\"} 8\n"));
        Assertions.assertTrue(text.contains("agentmesh_agent_load_avg 0.500\n"));
        Assertions.assertTrue(text.contains("agentmesh_response_time_avg_ms 12.250\n"));
        Assertions.assertTrue(text.contains("agentmesh_cache_misses_total 3\n"));
        Assertions.assertTrue(text.contains("agentmesh_bus_event_count{event=\"agent:registered\"} 3\n"));
        Assertions.assertTrue(text.contains("agentmesh_workflows_active 1\n"));
        Assertions.assertEquals(1, occurrences(text, "# HELP agentmesh_agents "));
        Assertions.assertFalse(text.contains("namespace="));
    }

    @Test
    void namespaceLabelIsAddedToEverySample() {
        String text = PrometheusFormatter.format(router, bus(), health, limiter, "lab \"a\"");

        Assertions.assertTrue(text.contains("agentmesh_agents{namespace=\"lab \\\"a\\\"\",status=\"busy\"} 1\n"));
        Assertions.assertTrue(text.contains("agentmesh_agents_total{namespace=\"lab \\\"a\\\"\"} 3\n"));
        Assertions.assertTrue(text.endsWith("agentmesh_namespace_info{namespace=\"lab \\\"a\\\"\"} 1\n"));
    }

    private static BusMetrics bus() {
        return new BusMetrics(5L, 0L, 2, 1, 2.0, 0.0, 0, Map.of("agent:registered", 3L, "agent:timeout", 2L), Instant.parse("2026-01-01T00:00:00Z"));
    }

    private static int occurrences(String text, String needle) {
        int count = 0;
        int from = 0;
        while ((from = text.indexOf(needle, from)) >= 0) {
            count++;
            from += needle.length();
        }
        return count;
    }
}
