package io.resolvequeue.model;

/**
 * Listing filter; null or blank fields do not constrain the result.
 */
public record ListJobsOptions(JobState state, String workerHostname) {
    public static ListJobsOptions all() {
        return new ListJobsOptions(null, null);
    }

    public static ListJobsOptions inState(JobState state) {
        return new ListJobsOptions(state, null);
    }

    public static ListJobsOptions ownedBy(String workerHostname) {
        return new ListJobsOptions(null, workerHostname);
    }
}
