package io.meshbroker.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class BrokerConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final int DEFAULT_WS_PORT = 8080;
    public static final int DEFAULT_HTTP_PORT = 8081;
    public static final String DEFAULT_WS_PATH = "/ws";
    public static final long DEFAULT_TASK_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_AUDIT_MAX_ENTRIES = 10_000;
    public static final int DEFAULT_STORE_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_STORE_RETRY_DELAY_MS = 1_000L;
    public static final int DEFAULT_MAX_FRAME_BYTES = 64 * 1024;
    public static final String BROADCAST_TOKEN = "broadcast";
    public static final String CAPABILITY_SELECTOR_PREFIX = "type:";

    private final Path rootDir;

    public BrokerConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static BrokerConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new BrokerConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("meshbroker.db");
    }

    public Path settingsFile() {
        return rootDir.resolve("meshbroker-settings.json");
    }
}
