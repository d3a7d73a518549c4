package io.resolvequeue.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How one claim cycle of a job ended.
 */
public enum AttemptOutcome {
    COMPLETED("completed"),
    FAILED("failed"),
    ERRORED("errored"),
    REQUEUED("requeued"),
    RESET("reset");

    private final String dbValue;

    AttemptOutcome(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() {
        return dbValue;
    }

    public static AttemptOutcome fromDb(String raw) {
        for (AttemptOutcome value : values()) {
            if (value.dbValue.equals(raw)) {
                return value;
            }
        }
        throw new IllegalStateException("Unknown attempt outcome in execution log: " + raw);
    }
}
