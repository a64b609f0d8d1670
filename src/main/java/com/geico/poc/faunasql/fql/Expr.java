package com.geico.poc.faunasql.fql;

/**
 * Node of a query expression sent to the document store.
 *
 * The tree is a tagged union: {@link Literal}, {@link ArrayExpr}, {@link ObjectExpr},
 * {@link Var}, {@link Lambda}, {@link Let} and {@link Call}, where a call is tagged by its
 * {@link Form}. Building a tree never talks to the store; {@link FqlSerializer} turns it into
 * the wire format separately.
 */
public abstract class Expr {

    Expr() {
    }

    public abstract <R> R accept(ExprVisitor<R> visitor);

    @Override
    public String toString() {
        return FqlSerializer.toJson(this);
    }
}
