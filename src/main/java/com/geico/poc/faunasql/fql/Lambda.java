package com.geico.poc.faunasql.fql;

import java.util.Collections;
import java.util.List;

/**
 * Anonymous function. With more than one parameter the argument is destructured as an array.
 */
public final class Lambda extends Expr {

    private final List<String> params;
    private final Expr body;

    public Lambda(List<String> params, Expr body) {
        if (params.isEmpty()) {
            throw new IllegalArgumentException("Lambda needs at least one parameter");
        }
        this.params = Collections.unmodifiableList(params);
        this.body = body;
    }

    public List<String> getParams() {
        return params;
    }

    public Expr getBody() {
        return body;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitLambda(this);
    }
}
