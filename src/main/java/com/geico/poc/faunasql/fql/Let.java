package com.geico.poc.faunasql.fql;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sequential bindings: each binding can refer to the ones before it.
 */
public final class Let extends Expr {

    private final Map<String, Expr> bindings;
    private final Expr in;

    public Let(Map<String, Expr> bindings, Expr in) {
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
        this.in = in;
    }

    public Map<String, Expr> getBindings() {
        return bindings;
    }

    public Expr getIn() {
        return in;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitLet(this);
    }
}
