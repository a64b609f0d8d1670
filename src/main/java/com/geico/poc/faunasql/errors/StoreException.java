package com.geico.poc.faunasql.errors;

/**
 * Error reported by the document store that has no more specific mapping.
 * Keeps the store's own error code and description.
 */
public class StoreException extends FaunaSqlException {

    private final String code;
    private final String description;

    public StoreException(String code, String description) {
        super(code + ": " + description);
        this.code = code;
        this.description = description;
    }

    public StoreException(String code, String description, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }
}
