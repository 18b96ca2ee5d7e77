package io.agentmesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public final class MeshConfig {
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String SETTINGS_FILE_NAME = "agentmesh-settings.json";
    public static final int DEFAULT_WORKER_THREADS = 8;
    public static final int DEFAULT_WORKFLOW_THREADS = 4;
    public static final long DEFAULT_MESSAGE_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_STEP_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_HEARTBEAT_TIMEOUT_MS = 60_000L;
    public static final long DEFAULT_HEARTBEAT_SWEEP_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_CACHE_TTL_MS = 5L * 60L * 1000L;
    public static final int DEFAULT_CACHE_MAX_ENTRIES = 500;
    public static final long DEFAULT_ROUTER_RETRY_BASE_DELAY_MS = 1_000L;
    public static final int DEFAULT_EVENT_HISTORY_MAX = 1_000;
    public static final int DEFAULT_BREAKER_FAILURE_THRESHOLD = 5;
    public static final long DEFAULT_BREAKER_RECOVERY_TIMEOUT_MS = 60_000L;
    public static final long DEFAULT_RATE_LIMIT_WINDOW_MS = 60_000L;
    public static final int DEFAULT_RATE_LIMIT_GLOBAL = 1_000;
    public static final int DEFAULT_RATE_LIMIT_PER_AGENT = 100;
    public static final int DEFAULT_RATE_LIMIT_EXTERNAL_API = 50;
    public static final int DEFAULT_BLOCK_AFTER_VIOLATIONS = 10;
    public static final List<String> DEFAULT_IDEMPOTENT_METHODS = List.of(
            "resources/list",
            "resources/read",
            "tools/list",
            "prompts/list",
            "bitcoin/price",
            "bitcoin/fees",
            "news/list"
    );

    private final String namespace;
    private final Path settingsFile;

    public MeshConfig(String namespace, Path settingsFile) {
        this.namespace = sanitizeNamespace(namespace);
        this.settingsFile = settingsFile;
    }

    public static MeshConfig defaults() {
        return new MeshConfig(DEFAULT_NAMESPACE, null);
    }

    /**
     * Looks for {@value #SETTINGS_FILE_NAME} under {@code root}; a missing file means defaults.
     */
    public static MeshConfig fromRoot(String root, String namespace) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(".")
                : Paths.get(root);
        return new MeshConfig(namespace, resolved.toAbsolutePath().normalize().resolve(SETTINGS_FILE_NAME));
    }

    private static String sanitizeNamespace(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_NAMESPACE : raw.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        return value.isBlank() ? DEFAULT_NAMESPACE : value;
    }

    public String namespace() {
        return namespace;
    }

    public Path settingsFile() {
        return settingsFile;
    }

    public MeshSettings loadSettings() {
        return MeshSettings.load(settingsFile);
    }
}
