package com.geico.poc.faunasql.errors;

/**
 * Thrown when a statement uses SQL the translator does not support.
 * Always raised before the statement's query is sent; only a JOIN needs the store first, to read
 * back whether its key column is a declared foreign key.
 */
public class TranslationRejectedException extends FaunaSqlException {

    public TranslationRejectedException(String message) {
        super(message);
    }

    public TranslationRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
