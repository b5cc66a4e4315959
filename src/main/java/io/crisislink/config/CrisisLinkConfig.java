package io.crisislink.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class CrisisLinkConfig {
    public static final String SETTINGS_FILE = "crisislink-settings.json";
    public static final int DEFAULT_MAX_CONNECTIONS = 2_000;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_BACKOFF_MS = 10L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 80L;
    public static final long DEFAULT_RECONNECT_INTERVAL_MS = 2_000L;
    public static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = 10;
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_CONNECTION_TIMEOUT_MS = 2_000L;
    public static final int DEFAULT_MESSAGE_QUEUE_SIZE = 100;
    public static final int DEFAULT_BREAKER_FAILURE_THRESHOLD = 5;
    public static final long DEFAULT_BREAKER_COOLDOWN_MS = 60_000L;
    public static final int DEFAULT_BREAKER_HALF_OPEN_SUCCESSES = 3;
    public static final long DEFAULT_HANDSHAKE_BUDGET_MS = 50L;
    public static final long DEFAULT_DELIVERY_BUDGET_MS = 100L;
    public static final long DEFAULT_ESCALATION_BUDGET_MS = 200L;
    public static final long DEFAULT_FAILOVER_WINDOW_MS = 5_000L;
    public static final long DEFAULT_MAX_SESSION_DURATION_MS = 4L * 60L * 60L * 1000L;
    public static final long DEFAULT_INACTIVITY_TIMEOUT_MS = 60L * 60L * 1000L;
    public static final int DEFAULT_ESCALATION_SEVERITY_THRESHOLD = 8;
    public static final int DEFAULT_VOLUNTEER_CAPACITY = 3;

    private final Path rootDir;

    public CrisisLinkConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static CrisisLinkConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new CrisisLinkConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path dbFile() {
        return rootDir.resolve("crisislink.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path payloadKeyFile() {
        return securityRoot().resolve("payload-keys.json");
    }

    public Path auditSigningKeyFile() {
        return securityRoot().resolve("audit-signing.key");
    }

    /** Optional external command used to reach emergency channels. */
    public Path notifyCommandFile() {
        return rootDir.resolve("notify").resolve("command.json");
    }
}
