package io.resolvequeue.worker;

import io.resolvequeue.model.ResolutionJob;

/**
 * Executes one claimed job. A thrown exception counts as a retryable failure.
 */
public interface JobHandler {
    JobResult handle(ResolutionJob job) throws Exception;
}
