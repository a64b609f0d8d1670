package com.geico.poc.faunasql.fql;

import java.util.Collections;
import java.util.List;

public final class ArrayExpr extends Expr {

    private final List<Expr> elements;

    public ArrayExpr(List<Expr> elements) {
        this.elements = Collections.unmodifiableList(elements);
    }

    public List<Expr> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public Expr get(int i) {
        return elements.get(i);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitArray(this);
    }
}
