package io.resolvequeue.config;

import io.resolvequeue.retry.BackoffFunction;
import io.resolvequeue.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Effective queue settings. Values come from {@code resolvequeue-settings.json} in the
 * namespace root when present; every missing or out-of-range value falls back to the
 * default or is raised to its lower bound.
 */
public record QueueSettings(
        int maxResets,
        int maxFailures,
        long heartbeatTimeoutMs,
        BackoffFunction backoffFunction,
        long baseBackoffMs,
        long maxBackoffMs,
        long reclaimIntervalMs,
        long claimTimeoutMs,
        long busyTimeoutMs
) {
    public static QueueSettings defaults() {
        return new QueueSettings(
                QueueConfig.DEFAULT_MAX_RESETS,
                QueueConfig.DEFAULT_MAX_FAILURES,
                QueueConfig.DEFAULT_HEARTBEAT_TIMEOUT_MS,
                BackoffFunction.EXPONENTIAL,
                QueueConfig.DEFAULT_BASE_BACKOFF_MS,
                QueueConfig.DEFAULT_MAX_BACKOFF_MS,
                QueueConfig.DEFAULT_RECLAIM_INTERVAL_MS,
                QueueConfig.DEFAULT_CLAIM_TIMEOUT_MS,
                QueueConfig.DEFAULT_BUSY_TIMEOUT_MS
        );
    }

    public static QueueSettings load(Path settingsFile) {
        QueueSettings defaults = defaults();
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load queue settings: " + settingsFile, e);
        }
    }

    static QueueSettings fromFile(SettingsFile file, QueueSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int maxResets = sanitizeInt(file.maxResets(), defaults.maxResets(), 0);
        int maxFailures = sanitizeInt(file.maxFailures(), defaults.maxFailures(), 1);
        long heartbeatTimeout = sanitizeLong(file.heartbeatTimeoutMs(), defaults.heartbeatTimeoutMs(), 100L);
        BackoffFunction backoff = file.backoffFunction() == null || file.backoffFunction().isBlank()
                ? defaults.backoffFunction()
                : BackoffFunction.fromString(file.backoffFunction());
        long baseBackoff = sanitizeLong(file.baseBackoffMs(), defaults.baseBackoffMs(), 1L);
        long maxBackoff = sanitizeLong(file.maxBackoffMs(), defaults.maxBackoffMs(), baseBackoff);
        if (maxBackoff < baseBackoff) {
            maxBackoff = baseBackoff;
        }
        long reclaimInterval = sanitizeLong(file.reclaimIntervalMs(), defaults.reclaimIntervalMs(), 100L);
        long claimTimeout = sanitizeLong(file.claimTimeoutMs(), defaults.claimTimeoutMs(), 1_000L);
        long busyTimeout = sanitizeLong(file.busyTimeoutMs(), defaults.busyTimeoutMs(), 0L);
        return new QueueSettings(
                maxResets,
                maxFailures,
                heartbeatTimeout,
                backoff,
                baseBackoff,
                maxBackoff,
                reclaimInterval,
                claimTimeout,
                busyTimeout
        );
    }

    /** Claim timeout in whole seconds, the granularity JDBC query timeouts accept. */
    public int claimTimeoutSeconds() {
        return toTimeoutSeconds(claimTimeoutMs);
    }

    public static int toTimeoutSeconds(long timeoutMs) {
        return (int) Math.max(1L, (timeoutMs + 999L) / 1_000L);
    }

    public List<String> diff(QueueSettings other) {
        List<String> changed = new ArrayList<>();
        if (other == null) {
            return changed;
        }
        if (maxResets != other.maxResets) changed.add("maxResets");
        if (maxFailures != other.maxFailures) changed.add("maxFailures");
        if (heartbeatTimeoutMs != other.heartbeatTimeoutMs) changed.add("heartbeatTimeoutMs");
        if (backoffFunction != other.backoffFunction) changed.add("backoffFunction");
        if (baseBackoffMs != other.baseBackoffMs) changed.add("baseBackoffMs");
        if (maxBackoffMs != other.maxBackoffMs) changed.add("maxBackoffMs");
        if (reclaimIntervalMs != other.reclaimIntervalMs) changed.add("reclaimIntervalMs");
        if (claimTimeoutMs != other.claimTimeoutMs) changed.add("claimTimeoutMs");
        if (busyTimeoutMs != other.busyTimeoutMs) changed.add("busyTimeoutMs");
        return changed;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    record SettingsFile(
            Integer maxResets,
            Integer maxFailures,
            Long heartbeatTimeoutMs,
            String backoffFunction,
            Long baseBackoffMs,
            Long maxBackoffMs,
            Long reclaimIntervalMs,
            Long claimTimeoutMs,
            Long busyTimeoutMs
    ) {
    }
}
