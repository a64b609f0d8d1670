package com.geico.poc.faunasql.client;

/**
 * How often, and after what pause, a retryable store error is retried.
 */
public interface RetryPolicy {

    int getMaxRetries();

    /**
     * Milliseconds to wait before retry number {@code retry} (1-based).
     */
    long backoffMillis(int retry);

    static RetryPolicy none() {
        return new BoundedLinearRetryPolicy(0, 0);
    }
}
