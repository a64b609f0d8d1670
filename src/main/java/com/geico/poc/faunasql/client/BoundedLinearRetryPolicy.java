package com.geico.poc.faunasql.client;

/**
 * Waits {@code retry × step} before each retry, up to a fixed number of retries.
 */
public class BoundedLinearRetryPolicy implements RetryPolicy {

    private final int maxRetries;
    private final long stepMillis;

    public BoundedLinearRetryPolicy(int maxRetries, long stepMillis) {
        if (maxRetries < 0 || stepMillis < 0) {
            throw new IllegalArgumentException(
                "Retry limits must not be negative: maxRetries=" + maxRetries + ", step=" + stepMillis);
        }
        this.maxRetries = maxRetries;
        this.stepMillis = stepMillis;
    }

    @Override
    public int getMaxRetries() {
        return maxRetries;
    }

    @Override
    public long backoffMillis(int retry) {
        return retry * stepMillis;
    }

    @Override
    public String toString() {
        return "BoundedLinearRetryPolicy{maxRetries=" + maxRetries + ", stepMillis=" + stepMillis + "}";
    }
}
