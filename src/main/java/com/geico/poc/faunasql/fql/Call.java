package com.geico.poc.faunasql.fql;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Application of a store function. Arguments line up with {@link Form#getKeys()}; a
 * {@code null} argument means the optional key is left out.
 */
public final class Call extends Expr {

    private final Form form;
    private final List<Expr> args;

    public Call(Form form, Expr... args) {
        if (args.length != form.arity()) {
            throw new IllegalArgumentException(
                form + " takes " + form.arity() + " arguments, got " + args.length);
        }
        if (args[0] == null) {
            throw new IllegalArgumentException(form + " requires its first argument");
        }
        this.form = form;
        this.args = Collections.unmodifiableList(Arrays.asList(args));
    }

    public Form getForm() {
        return form;
    }

    public List<Expr> getArgs() {
        return args;
    }

    public Expr arg(int i) {
        return args.get(i);
    }

    public boolean is(Form other) {
        return form == other;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
