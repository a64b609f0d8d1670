package com.geico.poc.faunasql.fql;

import java.util.Objects;

/**
 * Reference to a document, as decoded from a store response.
 */
public final class Ref {

    private final String collection;
    private final String id;

    public Ref(String collection, String id) {
        this.collection = collection;
        this.id = id;
    }

    /**
     * Name of the referenced collection, or null for refs to schema objects themselves.
     */
    public String getCollection() {
        return collection;
    }

    public String getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Ref ref = (Ref) o;
        return Objects.equals(collection, ref.collection) && Objects.equals(id, ref.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(collection, id);
    }

    @Override
    public String toString() {
        return "Ref(" + collection + ", " + id + ")";
    }
}
