package io.resolvequeue.model;

/**
 * Lookup predicates, combined with AND. At least one must be set.
 */
public record GetJobOptions(Long id, Long batchSpecId) {
    public static GetJobOptions byId(long id) {
        return new GetJobOptions(id, null);
    }

    public static GetJobOptions byBatchSpec(long batchSpecId) {
        return new GetJobOptions(null, batchSpecId);
    }

    public boolean empty() {
        return id == null && batchSpecId == null;
    }
}
