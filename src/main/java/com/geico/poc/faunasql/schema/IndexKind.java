package com.geico.poc.faunasql.schema;

/**
 * Kinds of index provisioned for every table. The lowercase name is the index name suffix.
 */
public enum IndexKind {
    /** Unfiltered enumeration of every document ref. */
    ALL,
    /** Keyed by ref, or by a foreign-key ref when built for a column. */
    REF,
    /** Exact lookup on one field; unique when the column is. */
    TERM,
    /** Field value plus ref, ordered for range scans. */
    VALUE,
    /** Keyed by ref, yields value plus ref so a ref set can be re-ordered. */
    SORT;

    public String suffix() {
        return name().toLowerCase();
    }
}
