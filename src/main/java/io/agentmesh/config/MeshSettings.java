package io.agentmesh.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.agentmesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.LinkedHashSet;

/**
 * Effective tuning values for one mesh. Every field falls back to the matching
 * {@link MeshConfig} default when absent or out of range in the settings file.
 */
public record MeshSettings(
        int workerThreads,
        int workflowThreads,
        long defaultMessageTimeoutMs,
        long defaultStepTimeoutMs,
        long heartbeatTimeoutMs,
        long heartbeatSweepIntervalMs,
        long cacheTtlMs,
        int cacheMaxEntries,
        Set<String> idempotentMethods,
        long routerRetryBaseDelayMs,
        int eventHistoryMax,
        int breakerFailureThreshold,
        long breakerRecoveryTimeoutMs,
        long rateLimitWindowMs,
        int rateLimitGlobal,
        int rateLimitPerAgent,
        int rateLimitExternalApi,
        int blockAfterViolations
) {
    public MeshSettings {
        idempotentMethods = Set.copyOf(idempotentMethods == null ? Set.of() : idempotentMethods);
    }

    public static MeshSettings defaults() {
        return new MeshSettings(
                MeshConfig.DEFAULT_WORKER_THREADS,
                MeshConfig.DEFAULT_WORKFLOW_THREADS,
                MeshConfig.DEFAULT_MESSAGE_TIMEOUT_MS,
                MeshConfig.DEFAULT_STEP_TIMEOUT_MS,
                MeshConfig.DEFAULT_HEARTBEAT_TIMEOUT_MS,
                MeshConfig.DEFAULT_HEARTBEAT_SWEEP_INTERVAL_MS,
                MeshConfig.DEFAULT_CACHE_TTL_MS,
                MeshConfig.DEFAULT_CACHE_MAX_ENTRIES,
                new LinkedHashSet<>(MeshConfig.DEFAULT_IDEMPOTENT_METHODS),
                MeshConfig.DEFAULT_ROUTER_RETRY_BASE_DELAY_MS,
                MeshConfig.DEFAULT_EVENT_HISTORY_MAX,
                MeshConfig.DEFAULT_BREAKER_FAILURE_THRESHOLD,
                MeshConfig.DEFAULT_BREAKER_RECOVERY_TIMEOUT_MS,
                MeshConfig.DEFAULT_RATE_LIMIT_WINDOW_MS,
                MeshConfig.DEFAULT_RATE_LIMIT_GLOBAL,
                MeshConfig.DEFAULT_RATE_LIMIT_PER_AGENT,
                MeshConfig.DEFAULT_RATE_LIMIT_EXTERNAL_API,
                MeshConfig.DEFAULT_BLOCK_AFTER_VIOLATIONS
        );
    }

    public static MeshSettings load(Path settingsFile) {
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults();
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults());
        } catch (IOException e) {
            throw new RuntimeException("Failed to load mesh settings: " + settingsFile, e);
        }
    }

    public static MeshSettings fromJson(String json) {
        if (json == null || json.isBlank()) {
            return defaults();
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(json, SettingsFile.class);
            return fromFile(file, defaults());
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid mesh settings JSON", e);
        }
    }

    static MeshSettings fromFile(SettingsFile file, MeshSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long heartbeatTimeout = sanitizeLong(file.heartbeatTimeoutMs(), defaults.heartbeatTimeoutMs(), 10L);
        long sweepInterval = sanitizeLong(file.heartbeatSweepIntervalMs(), defaults.heartbeatSweepIntervalMs(), 10L);
        if (file.heartbeatSweepIntervalMs() == null && sweepInterval > heartbeatTimeout) {
            sweepInterval = Math.max(10L, heartbeatTimeout / 2L);
        }
        Set<String> idempotent = file.idempotentMethods() == null
                ? defaults.idempotentMethods()
                : new LinkedHashSet<>(file.idempotentMethods().stream()
                        .filter(m -> m != null && !m.isBlank())
                        .map(String::trim)
                        .toList());
        return new MeshSettings(
                sanitizeInt(file.workerThreads(), defaults.workerThreads(), 1),
                sanitizeInt(file.workflowThreads(), defaults.workflowThreads(), 1),
                sanitizeLong(file.defaultMessageTimeoutMs(), defaults.defaultMessageTimeoutMs(), 1L),
                sanitizeLong(file.defaultStepTimeoutMs(), defaults.defaultStepTimeoutMs(), 1L),
                heartbeatTimeout,
                sweepInterval,
                sanitizeLong(file.cacheTtlMs(), defaults.cacheTtlMs(), 0L),
                sanitizeInt(file.cacheMaxEntries(), defaults.cacheMaxEntries(), 1),
                idempotent,
                sanitizeLong(file.routerRetryBaseDelayMs(), defaults.routerRetryBaseDelayMs(), 0L),
                sanitizeInt(file.eventHistoryMax(), defaults.eventHistoryMax(), 1),
                sanitizeInt(file.breakerFailureThreshold(), defaults.breakerFailureThreshold(), 1),
                sanitizeLong(file.breakerRecoveryTimeoutMs(), defaults.breakerRecoveryTimeoutMs(), 1L),
                sanitizeLong(file.rateLimitWindowMs(), defaults.rateLimitWindowMs(), 1L),
                sanitizeInt(file.rateLimitGlobal(), defaults.rateLimitGlobal(), 1),
                sanitizeInt(file.rateLimitPerAgent(), defaults.rateLimitPerAgent(), 1),
                sanitizeInt(file.rateLimitExternalApi(), defaults.rateLimitExternalApi(), 1),
                sanitizeInt(file.blockAfterViolations(), defaults.blockAfterViolations(), 0)
        );
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Integer workerThreads,
            Integer workflowThreads,
            Long defaultMessageTimeoutMs,
            Long defaultStepTimeoutMs,
            Long heartbeatTimeoutMs,
            Long heartbeatSweepIntervalMs,
            Long cacheTtlMs,
            Integer cacheMaxEntries,
            List<String> idempotentMethods,
            Long routerRetryBaseDelayMs,
            Integer eventHistoryMax,
            Integer breakerFailureThreshold,
            Long breakerRecoveryTimeoutMs,
            Long rateLimitWindowMs,
            Integer rateLimitGlobal,
            Integer rateLimitPerAgent,
            Integer rateLimitExternalApi,
            Integer blockAfterViolations
    ) {
    }
}
