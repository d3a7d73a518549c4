package io.resolvequeue.model;

/**
 * Submission descriptor. A null {@code state} defaults to {@link JobState#QUEUED}; a null
 * {@code createdAtMs} defaults to the submission time.
 */
public record NewResolutionJob(
        long batchSpecId,
        boolean allowUnsupported,
        boolean allowIgnored,
        JobState state,
        Long createdAtMs
) {
    public static NewResolutionJob queued(long batchSpecId) {
        return new NewResolutionJob(batchSpecId, false, false, null, null);
    }

    public static NewResolutionJob queued(long batchSpecId, boolean allowUnsupported, boolean allowIgnored) {
        return new NewResolutionJob(batchSpecId, allowUnsupported, allowIgnored, null, null);
    }
}
