package com.geico.poc.faunasql.errors;

/**
 * Thrown when a retryable store error persists after the retry policy gave up.
 */
public class TransientStoreException extends FaunaSqlException {

    private final int attempts;

    public TransientStoreException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
