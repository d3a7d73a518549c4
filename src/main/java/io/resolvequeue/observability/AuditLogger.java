package io.resolvequeue.observability;

import io.resolvequeue.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends job lifecycle events as JSON lines. Several processes may append to the same
 * file; each event is a single write of one line.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final String namespace;
    private final Clock clock;

    public AuditLogger(Path auditFile, String namespace, Clock clock) {
        this.auditFile = auditFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.clock = clock == null ? Clock.systemUTC() : clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
    }

    public Path auditFile() {
        return auditFile;
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now(clock).toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("job_id", event.jobId());
        row.put("details", event.details());
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Long jobId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(
                String action,
                String actor,
                String resource,
                String result,
                Long jobId,
                Map<String, Object> details
        ) {
            return new AuditEvent(
                    action,
                    actor == null || actor.isBlank() ? "system" : actor.trim(),
                    resource,
                    result,
                    jobId,
                    details == null ? Map.of() : details
            );
        }
    }
}
