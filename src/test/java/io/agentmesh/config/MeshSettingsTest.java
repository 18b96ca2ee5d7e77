package io.agentmesh.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

final class MeshSettingsTest {
    @TempDir
    Path tempDir;

    @Test
    void missingFileYieldsDefaults() {
        MeshSettings settings = MeshSettings.load(tempDir.resolve("absent.json"));

        Assertions.assertEquals(MeshSettings.defaults(), settings);
        Assertions.assertEquals(8, settings.workerThreads());
        Assertions.assertEquals(100, settings.rateLimitPerAgent());
        Assertions.assertTrue(settings.idempotentMethods().contains("tools/list"));
    }

    @Test
    void invalidValuesFallBackToDefaults() {
        MeshSettings settings = MeshSettings.fromJson("""
                {
                  "workerThreads": 0,
                  "cacheMaxEntries": -3,
                  "breakerFailureThreshold": 2,
                  "unknownKey": true
                }
                """);

        Assertions.assertEquals(MeshConfig.DEFAULT_WORKER_THREADS, settings.workerThreads());
        Assertions.assertEquals(MeshConfig.DEFAULT_CACHE_MAX_ENTRIES, settings.cacheMaxEntries());
        Assertions.assertEquals(2, settings.breakerFailureThreshold());
    }

    @Test
    void shortHeartbeatTimeoutDerivesSweepInterval() {
        MeshSettings derived = MeshSettings.fromJson("{\"heartbeatTimeoutMs\": 1000}");
        MeshSettings explicit = MeshSettings.fromJson("{\"heartbeatTimeoutMs\": 1000, \"heartbeatSweepIntervalMs\": 2000}");

        Assertions.assertEquals(500L, derived.heartbeatSweepIntervalMs());
        Assertions.assertEquals(2000L, explicit.heartbeatSweepIntervalMs());
    }

    @Test
    void idempotentMethodsCanBeReplaced() {
        MeshSettings settings = MeshSettings.fromJson("{\"idempotentMethods\": [\" weather/read \", \"\", \"echo\"]}");

        Assertions.assertEquals(Set.of("weather/read", "echo"), settings.idempotentMethods());
    }

    @Test
    void settingsFileUnderRootIsLoaded() throws Exception {
        Files.writeString(
                tempDir.resolve(MeshConfig.SETTINGS_FILE_NAME),
                "{\"workflowThreads\": 2, \"rateLimitWindowMs\": 5000}",
                StandardCharsets.UTF_8
        );

        MeshConfig config = MeshConfig.fromRoot(tempDir.toString(), "team");
        MeshSettings settings = config.loadSettings();

        Assertions.assertEquals(2, settings.workflowThreads());
        Assertions.assertEquals(5000L, settings.rateLimitWindowMs());
        Assertions.assertEquals("team", config.namespace());
    }

    @Test
    void malformedJsonIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> MeshSettings.fromJson("{not json"));
    }

    @Test
    void namespaceIsSanitized() {
        Assertions.assertEquals("research-lab", new MeshConfig(" Research Lab ", null).namespace());
        Assertions.assertEquals("a-b", new MeshConfig("a//b", null).namespace());
        Assertions.assertEquals(MeshConfig.DEFAULT_NAMESPACE, new MeshConfig("  ", null).namespace());
    }
}
