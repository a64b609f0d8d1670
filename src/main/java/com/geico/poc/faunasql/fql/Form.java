package com.geico.poc.faunasql.fql;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Store functions and their wire keys. The first key names the function and carries the
 * first argument; the remaining keys carry the others in order.
 */
public enum Form {
    // sets
    MATCH("match", "terms"),
    RANGE("range", "from", "to"),
    JOIN("join", "with"),
    UNION("union"),
    INTERSECTION("intersection"),
    DIFFERENCE("difference"),
    SINGLETON("singleton"),
    REVERSE("reverse"),
    PAGINATE("paginate", "size"),

    // collections
    MAP("map", "collection"),
    FILTER("filter", "collection"),
    FOREACH("foreach", "collection"),
    REDUCE("reduce", "initial", "collection"),
    APPEND("append", "collection"),
    TAKE("take", "collection"),
    DISTINCT("distinct"),
    COUNT("count"),
    IS_EMPTY("is_empty"),
    TO_ARRAY("to_array"),
    TO_OBJECT("to_object"),

    // logic
    IF("if", "then", "else"),
    EQUALS("equals"),
    OR("or"),
    AND("and"),
    NOT("not"),
    IS_NULL("is_null"),
    DO("do"),

    // documents
    SELECT("select", "from", "default"),
    MERGE("merge", "with"),
    EXISTS("exists"),
    GET("get"),
    REF("ref", "id"),
    COLLECTION("collection"),
    INDEX("index"),
    CREATE("create", "params"),
    UPDATE("update", "params"),
    DELETE("delete"),
    CREATE_COLLECTION("create_collection"),
    CREATE_INDEX("create_index");

    private final List<String> keys;

    Form(String... keys) {
        this.keys = Collections.unmodifiableList(Arrays.asList(keys));
    }

    public String getName() {
        return keys.get(0);
    }

    public List<String> getKeys() {
        return keys;
    }

    public int arity() {
        return keys.size();
    }
}
