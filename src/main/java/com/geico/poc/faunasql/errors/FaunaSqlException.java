package com.geico.poc.faunasql.errors;

/**
 * Base class for every error raised while translating or executing SQL against the store.
 */
public class FaunaSqlException extends RuntimeException {

    public FaunaSqlException(String message) {
        super(message);
    }

    public FaunaSqlException(String message, Throwable cause) {
        super(message, cause);
    }
}
