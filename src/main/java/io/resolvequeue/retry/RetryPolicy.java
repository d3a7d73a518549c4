package io.resolvequeue.retry;

import io.resolvequeue.config.QueueSettings;

/**
 * Failure and reset bounds plus the backoff applied between failed attempts. The two
 * bounds are policed independently.
 */
public record RetryPolicy(
        int maxFailures,
        int maxResets,
        BackoffFunction backoffFunction,
        long baseBackoffMs,
        long maxBackoffMs
) {
    public RetryPolicy {
        if (maxFailures < 1) {
            throw new IllegalArgumentException("maxFailures must be >= 1");
        }
        if (maxResets < 0) {
            throw new IllegalArgumentException("maxResets must be >= 0");
        }
        backoffFunction = backoffFunction == null ? BackoffFunction.EXPONENTIAL : backoffFunction;
    }

    public static RetryPolicy from(QueueSettings settings) {
        return new RetryPolicy(
                settings.maxFailures(),
                settings.maxResets(),
                settings.backoffFunction(),
                settings.baseBackoffMs(),
                settings.maxBackoffMs()
        );
    }

    /** True once the failure count has reached the bound and the job must stop retrying. */
    public boolean failuresExhausted(int numFailures) {
        return numFailures >= maxFailures;
    }

    /** True once the reset count has gone past the bound. */
    public boolean resetsExhausted(int numResets) {
        return numResets > maxResets;
    }

    public long backoffMs(int numFailures) {
        return backoffFunction.delayMs(numFailures, baseBackoffMs, maxBackoffMs);
    }
}
