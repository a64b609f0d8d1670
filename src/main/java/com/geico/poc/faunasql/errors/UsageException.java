package com.geico.poc.faunasql.errors;

/**
 * Thrown when a connection or cursor is used in a state that does not allow the call.
 */
public class UsageException extends FaunaSqlException {

    public UsageException(String message) {
        super(message);
    }
}
