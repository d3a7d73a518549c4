package io.resolvequeue.model;

import java.util.List;

/**
 * One row of {@code batch_spec_resolution_jobs} together with its execution log.
 *
 * <p>{@code batchSpecId}, {@code allowUnsupported} and {@code allowIgnored} are carried
 * for the job handler only; the queue never interprets them. {@code progressDetail} is the
 * last progress text sent with a heartbeat during the current claim. Nullable timestamps are
 * epoch milliseconds.
 */
public record ResolutionJob(
        long id,
        long batchSpecId,
        boolean allowUnsupported,
        boolean allowIgnored,
        JobState state,
        String failureMessage,
        Long startedAtMs,
        Long finishedAtMs,
        Long processAfterMs,
        int numResets,
        int numFailures,
        List<ExecutionLogEntry> executionLogs,
        String workerHostname,
        String progressDetail,
        long version,
        long createdAtMs,
        long updatedAtMs
) {
    public ResolutionJob {
        executionLogs = executionLogs == null ? List.of() : List.copyOf(executionLogs);
        workerHostname = workerHostname == null ? "" : workerHostname;
    }
}
