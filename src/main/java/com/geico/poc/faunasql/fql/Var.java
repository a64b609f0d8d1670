package com.geico.poc.faunasql.fql;

public final class Var extends Expr {

    private final String name;

    public Var(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitVar(this);
    }
}
