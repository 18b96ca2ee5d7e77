package io.agentmesh.observability;

import io.agentmesh.bus.BusMetrics;
import io.agentmesh.resilience.RateLimiter;
import io.agentmesh.routing.RouterMetrics;
import io.agentmesh.runtime.HealthSnapshot;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(
            RouterMetrics router,
            BusMetrics bus,
            HealthSnapshot health,
            RateLimiter.Stats limiter
    ) {
        return format(router, bus, health, limiter, null);
    }

    public static String format(
            RouterMetrics router,
            BusMetrics bus,
            HealthSnapshot health,
            RateLimiter.Stats limiter,
            String namespace
    ) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "agentmesh_agents", "Registered agents grouped by status", "status", "active", router.activeAgents());
        appendGauge(sb, "agentmesh_agents", "Registered agents grouped by status", "status", "busy", router.busyAgents());
        appendGauge(sb, "agentmesh_agents", "Registered agents grouped by status", "status", "inactive", router.inactiveAgents());
        appendGauge(sb, "agentmesh_agents", "Registered agents grouped by status", "status", "error", router.errorAgents());
        appendGauge(sb, "agentmesh_agents_total", "Total registered agents", null, null, router.totalAgents());
        appendDouble(sb, "agentmesh_agent_load_avg", "Average in-flight messages per agent", router.averageLoad());
        appendGauge(sb, "agentmesh_router_queue_depth", "Messages waiting for dispatch", null, null, router.queueDepth());
        appendGauge(sb, "agentmesh_messages_total", "Routed messages grouped by outcome", "outcome", "routed", router.messagesRouted());
        appendGauge(sb, "agentmesh_messages_total", "Routed messages grouped by outcome", "outcome", "delivered", router.messagesDelivered());
        appendGauge(sb, "agentmesh_messages_total", "Routed messages grouped by outcome", "outcome", "failed", router.messagesFailed());
        appendGauge(sb, "agentmesh_messages_total", "Routed messages grouped by outcome", "outcome", "timeout", router.timeouts());
        appendDouble(sb, "agentmesh_response_time_avg_ms", "Average handler time of delivered messages", router.averageResponseTimeMs());
        appendGauge(sb, "agentmesh_messages_rejected_total", "Messages rejected before enqueue by rate limiting", null, null, router.rejected());
        appendGauge(sb, "agentmesh_cache_hits_total", "Idempotent responses served from cache", null, null, router.cacheHits());
        appendGauge(sb, "agentmesh_cache_misses_total", "Idempotent lookups not answered from cache", null, null, router.cacheMisses());
        appendGauge(sb, "agentmesh_cache_entries", "Cached idempotent responses", null, null, router.cacheEntries());

        appendGauge(sb, "agentmesh_bus_events_total", "Events dispatched by the bus", null, null, bus.totalEvents());
        appendGauge(sb, "agentmesh_bus_listener_errors_total", "Listener failures captured by the bus", null, null, bus.totalErrors());
        appendGauge(sb, "agentmesh_bus_listeners", "Subscribed listeners", null, null, bus.totalListeners());
        appendGauge(sb, "agentmesh_bus_scheduled_pending", "Delayed or retried emissions not yet dispatched", null, null, bus.pendingScheduled());
        appendMapGauge(sb, "agentmesh_bus_event_count", "Dispatches grouped by event name", "event", bus.eventCounts());

        appendGauge(sb, "agentmesh_workflows_active", "Workflows not yet terminal", null, null, health.activeWorkflows());
        appendGauge(sb, "agentmesh_pending_events", "Queued messages plus scheduled bus emissions", null, null, health.pendingEvents());

        appendGauge(sb, "agentmesh_rate_limit_windows", "Open rate limit windows", null, null, limiter.activeWindows());
        appendGauge(sb, "agentmesh_blocked_identifiers", "Identifiers blocked after repeated violations", null, null, limiter.blockedIdentifiers());
        appendGauge(sb, "agentmesh_suspicious_activity_total", "Recorded suspicious activities", null, null, limiter.suspiciousActivities());
        String base = sb.toString();
        String normalizedNamespace = namespace == null ? "" : namespace.trim();
        if (normalizedNamespace.isBlank()) {
            return base;
        }
        return withNamespaceLabel(base, escapeLabel(normalizedNamespace));
    }

    /**
     * Adds {@code namespace="..."} to every sample line and appends a marker gauge.
     */
    private static String withNamespaceLabel(String base, String escapedNs) {
        StringBuilder out = new StringBuilder(base.length() * 2);
        for (String line : base.split("\\r?\\n")) {
            if (line.isBlank()) {
                continue;
            }
            if (line.startsWith("#")) {
                out.append(line).append('\n');
                continue;
            }
            int sep = line.lastIndexOf(' ');
            String sample = line.substring(0, sep);
            String value = line.substring(sep + 1);
            int brace = sample.indexOf('{');
            if (brace >= 0 && sample.endsWith("}")) {
                out.append(sample, 0, brace + 1)
                        .append("namespace=\"").append(escapedNs).append("\",")
                        .append(sample.substring(brace + 1));
            } else {
                out.append(sample).append("{namespace=\"").append(escapedNs).append("\"}");
            }
            out.append(' ').append(value).append('\n');
        }
        out.append("# HELP agentmesh_namespace_info Mesh namespace marker\n");
        out.append("# TYPE agentmesh_namespace_info gauge\n");
        out.append("agentmesh_namespace_info{namespace=\"").append(escapedNs).append("\"} 1\n");
        return out.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Long> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Long> e : new TreeMap<>(values).entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        appendHeader(sb, metric, help);
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static void appendDouble(StringBuilder sb, String metric, String help, double value) {
        appendHeader(sb, metric, help);
        sb.append(metric).append(' ').append(String.format(Locale.ROOT, "%.3f", value)).append('\n');
    }

    private static void appendHeader(StringBuilder sb, String metric, String help) {
        if (sb.indexOf("# HELP " + metric + " ") < 0) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
