package io.resolvequeue.config;

import io.resolvequeue.retry.BackoffFunction;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class QueueSettingsTest {

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("resolvequeue-test-settings-missing-");
        try {
            QueueSettings settings = QueueSettings.load(root.resolve(QueueConfig.SETTINGS_FILE_NAME));
            Assertions.assertEquals(QueueSettings.defaults(), settings);
            Assertions.assertEquals(10, settings.claimTimeoutSeconds());
            Assertions.assertEquals(1, QueueSettings.toTimeoutSeconds(1L));
            Assertions.assertEquals(2, QueueSettings.toTimeoutSeconds(1_001L));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileValuesAreReadAndSanitized() throws Exception {
        Path root = Files.createTempDirectory("resolvequeue-test-settings-file-");
        try {
            Path file = root.resolve(QueueConfig.SETTINGS_FILE_NAME);
            Files.writeString(file, """
                    {
                      "maxResets": -4,
                      "maxFailures": 5,
                      "heartbeatTimeoutMs": 10,
                      "backoffFunction": "linear",
                      "baseBackoffMs": 2000,
                      "maxBackoffMs": 500,
                      "claimTimeoutMs": 2500
                    }
                    """, StandardCharsets.UTF_8);
            QueueSettings settings = QueueSettings.load(file);
            Assertions.assertEquals(0, settings.maxResets());
            Assertions.assertEquals(5, settings.maxFailures());
            Assertions.assertEquals(100L, settings.heartbeatTimeoutMs());
            Assertions.assertEquals(BackoffFunction.LINEAR, settings.backoffFunction());
            Assertions.assertEquals(2_000L, settings.baseBackoffMs());
            Assertions.assertEquals(2_000L, settings.maxBackoffMs());
            Assertions.assertEquals(QueueConfig.DEFAULT_RECLAIM_INTERVAL_MS, settings.reclaimIntervalMs());
            Assertions.assertEquals(3, settings.claimTimeoutSeconds());

            List<String> changed = QueueSettings.defaults().diff(settings);
            Assertions.assertTrue(changed.contains("maxResets"));
            Assertions.assertTrue(changed.contains("backoffFunction"));
            Assertions.assertFalse(changed.contains("reclaimIntervalMs"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownBackoffFunctionIsRejected() throws Exception {
        Path root = Files.createTempDirectory("resolvequeue-test-settings-bad-");
        try {
            Path file = root.resolve(QueueConfig.SETTINGS_FILE_NAME);
            Files.writeString(file, "{\"backoffFunction\":\"random\"}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> QueueSettings.load(file));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void namespaceIsScopedUnderSharedRoot() {
        QueueConfig base = QueueConfig.fromRoot("/tmp/rq");
        QueueConfig scoped = QueueConfig.fromRoot("/tmp/rq", "../Evil Ns");
        Assertions.assertEquals(QueueConfig.DEFAULT_NAMESPACE, base.namespace());
        Assertions.assertEquals(base.rootBaseDir(), base.rootDir());
        Assertions.assertEquals("ns..-evil-ns", scoped.namespace());
        Assertions.assertTrue(scoped.rootDir().startsWith(scoped.rootBaseDir().resolve(QueueConfig.DEFAULT_NAMESPACES_DIR)));
        Assertions.assertEquals(base.dbFile(), scoped.dbFile());
        Assertions.assertEquals(scoped.rootDir().resolve("audit").resolve("audit.log"), scoped.auditFile());
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
