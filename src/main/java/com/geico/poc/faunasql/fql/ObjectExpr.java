package com.geico.poc.faunasql.fql;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Object literal whose values are expressions. Field order is kept.
 */
public final class ObjectExpr extends Expr {

    private final Map<String, Expr> fields;

    public ObjectExpr(Map<String, Expr> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Map<String, Expr> getFields() {
        return fields;
    }

    public Expr get(String name) {
        return fields.get(name);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitObject(this);
    }
}
