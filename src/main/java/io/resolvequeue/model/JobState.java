package io.resolvequeue.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum JobState {
    QUEUED("queued"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed"),
    ERRORED("errored");

    private final String dbValue;

    JobState(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() {
        return dbValue;
    }

    /** Terminal rows are never claimed or mutated again. */
    public boolean terminal() {
        return this == COMPLETED || this == FAILED || this == ERRORED;
    }

    @JsonCreator
    public static JobState fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("job state must not be blank");
        }
        for (JobState value : values()) {
            if (value.dbValue.equalsIgnoreCase(raw.trim()) || value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown job state: " + raw);
    }
}
