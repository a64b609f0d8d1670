package com.geico.poc.faunasql.sql;

/**
 * How the filters of one group combine into a document set.
 */
public enum SetOperation {
    INTERSECTION,
    UNION
}
