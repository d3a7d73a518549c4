package io.resolvequeue.retry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Delay imposed before a failed job becomes eligible for claim again.
 *
 * <p>Every function is monotonically non-decreasing in the attempt number and never
 * exceeds the configured maximum.
 */
public enum BackoffFunction {
    EXPONENTIAL("exponential") {
        @Override
        long uncappedDelayMs(int attempt, long baseBackoffMs, long maxBackoffMs) {
            long backoff = baseBackoffMs;
            for (int i = 1; i < attempt; i++) {
                if (backoff >= maxBackoffMs / 2L) {
                    return maxBackoffMs;
                }
                backoff *= 2L;
            }
            return backoff;
        }
    },
    LINEAR("linear") {
        @Override
        long uncappedDelayMs(int attempt, long baseBackoffMs, long maxBackoffMs) {
            if (attempt > maxBackoffMs / baseBackoffMs) {
                return maxBackoffMs;
            }
            return baseBackoffMs * attempt;
        }
    },
    CONSTANT("constant") {
        @Override
        long uncappedDelayMs(int attempt, long baseBackoffMs, long maxBackoffMs) {
            return baseBackoffMs;
        }
    };

    private final String configName;

    BackoffFunction(String configName) {
        this.configName = configName;
    }

    @JsonValue
    public String configName() {
        return configName;
    }

    public long delayMs(int attempt, long baseBackoffMs, long maxBackoffMs) {
        long base = Math.max(1L, baseBackoffMs);
        long max = Math.max(base, maxBackoffMs);
        return Math.min(max, uncappedDelayMs(Math.max(1, attempt), base, max));
    }

    abstract long uncappedDelayMs(int attempt, long baseBackoffMs, long maxBackoffMs);

    @JsonCreator
    public static BackoffFunction fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return EXPONENTIAL;
        }
        for (BackoffFunction value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.configName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown backoff function: " + raw);
    }
}
