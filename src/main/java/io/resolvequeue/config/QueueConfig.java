package io.resolvequeue.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class QueueConfig {
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String DEFAULT_NAMESPACES_DIR = "namespaces";
    public static final String SETTINGS_FILE_NAME = "resolvequeue-settings.json";
    public static final int DEFAULT_MAX_RESETS = 3;
    public static final int DEFAULT_MAX_FAILURES = 3;
    public static final long DEFAULT_HEARTBEAT_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_BASE_BACKOFF_MS = 1_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 60_000L;
    public static final long DEFAULT_RECLAIM_INTERVAL_MS = 5_000L;
    public static final long DEFAULT_CLAIM_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_BUSY_TIMEOUT_MS = 5_000L;

    private final Path rootDir;
    private final Path rootBaseDir;
    private final String namespace;

    public QueueConfig(Path rootDir, Path rootBaseDir, String namespace) {
        this.rootDir = rootDir;
        this.rootBaseDir = rootBaseDir;
        this.namespace = namespace;
    }

    public static QueueConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_NAMESPACE);
    }

    public static QueueConfig fromRoot(String root, String namespace) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        String safeNamespace = sanitizeNamespace(namespace);
        Path scoped = DEFAULT_NAMESPACE.equals(safeNamespace)
                ? base
                : base.resolve(DEFAULT_NAMESPACES_DIR).resolve(safeNamespace);
        return new QueueConfig(scoped, base, safeNamespace);
    }

    static String sanitizeNamespace(String raw) {
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
        if (value.isBlank() || "-".equals(value)) {
            return DEFAULT_NAMESPACE;
        }
        if (value.startsWith(".")) {
            value = "ns" + value;
        }
        return value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path rootBaseDir() {
        return rootBaseDir;
    }

    public String namespace() {
        return namespace;
    }

    /**
     * Jobs of every namespace live in one database file at the base root, so workers
     * scoped to different namespaces still contend on the same write lock.
     */
    public Path dbFile() {
        return rootBaseDir.resolve("resolvequeue.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
