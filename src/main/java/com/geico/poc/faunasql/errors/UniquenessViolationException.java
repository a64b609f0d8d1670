package com.geico.poc.faunasql.errors;

/**
 * Thrown when a write collides with a unique term index.
 */
public class UniquenessViolationException extends FaunaSqlException {

    public UniquenessViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
