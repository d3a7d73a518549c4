package io.resolvequeue.storage;

/**
 * A store operation could not be carried out (connectivity, lock contention past the busy
 * timeout, cancelled claim). Nothing the failed operation attempted was committed; callers
 * are expected to back off and retry.
 */
public final class JobStoreException extends RuntimeException {
    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
