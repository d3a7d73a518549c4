package io.resolvequeue.model;

public record ExecutionLogEntry(
        int attempt,
        String workerHostname,
        long startedAtMs,
        long finishedAtMs,
        AttemptOutcome outcome,
        String detail
) {
    public long durationMs() {
        return Math.max(0L, finishedAtMs - startedAtMs);
    }
}
