package com.geico.poc.faunasql.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Sends one serialized query expression to the document store.
 */
public interface StoreTransport {

    /**
     * @param expression query in the store's JSON wire format
     * @return the {@code resource} the query evaluated to
     * @throws com.geico.poc.faunasql.errors.StoreException when the store reports an error
     */
    JsonNode query(JsonNode expression);
}
