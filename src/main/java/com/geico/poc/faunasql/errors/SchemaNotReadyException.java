package com.geico.poc.faunasql.errors;

/**
 * Thrown when a query references schema objects (collections, indexes) that do not exist yet.
 */
public class SchemaNotReadyException extends FaunaSqlException {

    public SchemaNotReadyException(String message, Throwable cause) {
        super(message, cause);
    }
}
