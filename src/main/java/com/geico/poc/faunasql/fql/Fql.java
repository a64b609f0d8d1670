package com.geico.poc.faunasql.fql;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static factory for query expressions, named after the store's own functions.
 */
public final class Fql {

    public static final Literal NULL = Literal.NULL;

    private Fql() {
    }

    // ---- values --------------------------------------------------------------------------

    public static Expr value(Object value) {
        if (value instanceof Expr) {
            return (Expr) value;
        }
        if (value instanceof List) {
            List<Expr> elements = new ArrayList<>();
            for (Object element : (List<?>) value) {
                elements.add(value(element));
            }
            return new ArrayExpr(elements);
        }
        if (value instanceof Map) {
            Map<String, Expr> fields = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                fields.put(String.valueOf(entry.getKey()), value(entry.getValue()));
            }
            return new ObjectExpr(fields);
        }
        return Literal.of(value);
    }

    public static ArrayExpr arr(Expr... elements) {
        return new ArrayExpr(Arrays.asList(elements));
    }

    public static ArrayExpr arr(List<? extends Expr> elements) {
        return new ArrayExpr(new ArrayList<>(elements));
    }

    public static ArrayExpr emptyArray() {
        return new ArrayExpr(Collections.emptyList());
    }

    /**
     * Object literal from alternating keys and values; plain Java values become literals.
     */
    public static ObjectExpr obj(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("obj() needs key/value pairs");
        }
        Map<String, Expr> fields = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            fields.put((String) keysAndValues[i], value(keysAndValues[i + 1]));
        }
        return new ObjectExpr(fields);
    }

    public static ObjectExpr obj(Map<String, ? extends Expr> fields) {
        return new ObjectExpr(new LinkedHashMap<>(fields));
    }

    public static Var var(String name) {
        return new Var(name);
    }

    public static Lambda lambda(String param, Expr body) {
        return new Lambda(Collections.singletonList(param), body);
    }

    public static Lambda lambda(List<String> params, Expr body) {
        return new Lambda(params, body);
    }

    public static Let let(Map<String, ? extends Expr> bindings, Expr in) {
        return new Let(new LinkedHashMap<>(bindings), in);
    }

    public static Let let(String name, Expr value, Expr in) {
        return new Let(Collections.singletonMap(name, value), in);
    }

    // ---- sets ----------------------------------------------------------------------------

    public static Call match(Expr index) {
        return new Call(Form.MATCH, index, null);
    }

    public static Call match(Expr index, Expr terms) {
        return new Call(Form.MATCH, index, terms);
    }

    public static Call range(Expr set, Expr from, Expr to) {
        return new Call(Form.RANGE, set, from, to);
    }

    public static Call join(Expr source, Expr with) {
        return new Call(Form.JOIN, source, with);
    }

    public static Call union(Expr... sets) {
        return new Call(Form.UNION, arr(sets));
    }

    public static Call union(List<? extends Expr> sets) {
        return new Call(Form.UNION, arr(sets));
    }

    public static Call intersection(List<? extends Expr> sets) {
        return new Call(Form.INTERSECTION, arr(sets));
    }

    public static Call intersection(Expr... sets) {
        return new Call(Form.INTERSECTION, arr(sets));
    }

    public static Call difference(Expr source, Expr... excluded) {
        List<Expr> sets = new ArrayList<>();
        sets.add(source);
        sets.addAll(Arrays.asList(excluded));
        return new Call(Form.DIFFERENCE, arr(sets));
    }

    public static Call singleton(Expr ref) {
        return new Call(Form.SINGLETON, ref);
    }

    public static Call reverse(Expr source) {
        return new Call(Form.REVERSE, source);
    }

    public static Call paginate(Expr set, int size) {
        return new Call(Form.PAGINATE, set, Literal.of(size));
    }

    // ---- collections ---------------------------------------------------------------------

    public static Call map(Lambda lambda, Expr collection) {
        return new Call(Form.MAP, lambda, collection);
    }

    public static Call filter(Lambda lambda, Expr collection) {
        return new Call(Form.FILTER, lambda, collection);
    }

    public static Call foreach(Lambda lambda, Expr collection) {
        return new Call(Form.FOREACH, lambda, collection);
    }

    public static Call reduce(Lambda lambda, Expr initial, Expr collection) {
        return new Call(Form.REDUCE, lambda, initial, collection);
    }

    /**
     * Array made of {@code base} followed by {@code elements}.
     */
    public static Call append(Expr elements, Expr base) {
        return new Call(Form.APPEND, elements, base);
    }

    public static Call take(int count, Expr collection) {
        return new Call(Form.TAKE, Literal.of(count), collection);
    }

    public static Call distinct(Expr collection) {
        return new Call(Form.DISTINCT, collection);
    }

    public static Call count(Expr collection) {
        return new Call(Form.COUNT, collection);
    }

    public static Call isEmpty(Expr collection) {
        return new Call(Form.IS_EMPTY, collection);
    }

    public static Call toArray(Expr object) {
        return new Call(Form.TO_ARRAY, object);
    }

    public static Call toObject(Expr pairs) {
        return new Call(Form.TO_OBJECT, pairs);
    }

    // ---- logic ---------------------------------------------------------------------------

    public static Call ifElse(Expr condition, Expr then, Expr otherwise) {
        return new Call(Form.IF, condition, then, otherwise);
    }

    public static Call eq(Expr left, Expr right) {
        return new Call(Form.EQUALS, arr(left, right));
    }

    public static Call or(Expr... operands) {
        return new Call(Form.OR, arr(operands));
    }

    public static Call and(Expr... operands) {
        return new Call(Form.AND, arr(operands));
    }

    public static Call not(Expr operand) {
        return new Call(Form.NOT, operand);
    }

    public static Call isNull(Expr operand) {
        return new Call(Form.IS_NULL, operand);
    }

    /**
     * Evaluates each expression in order and returns the last result.
     */
    public static Call sequence(List<? extends Expr> expressions) {
        return new Call(Form.DO, arr(expressions));
    }

    public static Call sequence(Expr... expressions) {
        return new Call(Form.DO, arr(expressions));
    }

    // ---- documents -----------------------------------------------------------------------

    public static ArrayExpr path(Object... segments) {
        List<Expr> elements = new ArrayList<>();
        for (Object segment : segments) {
            elements.add(value(segment));
        }
        return new ArrayExpr(elements);
    }

    public static Call select(Expr path, Expr from) {
        return new Call(Form.SELECT, path, from, null);
    }

    public static Call select(Expr path, Expr from, Expr defaultValue) {
        return new Call(Form.SELECT, path, from, defaultValue);
    }

    public static Call merge(Expr object, Expr with) {
        return new Call(Form.MERGE, object, with);
    }

    public static Call exists(Expr ref) {
        return new Call(Form.EXISTS, ref);
    }

    public static Call get(Expr ref) {
        return new Call(Form.GET, ref);
    }

    public static Call ref(Expr collection, Expr id) {
        return new Call(Form.REF, collection, id);
    }

    public static Call collection(String name) {
        return new Call(Form.COLLECTION, Literal.of(name));
    }

    /**
     * Collection whose name is only known when the query runs.
     */
    public static Call collection(Expr name) {
        return new Call(Form.COLLECTION, name);
    }

    public static Call index(String name) {
        return new Call(Form.INDEX, Literal.of(name));
    }

    public static Call index(Expr name) {
        return new Call(Form.INDEX, name);
    }

    public static Call create(Expr collection, Expr params) {
        return new Call(Form.CREATE, collection, params);
    }

    public static Call update(Expr ref, Expr params) {
        return new Call(Form.UPDATE, ref, params);
    }

    public static Call delete(Expr ref) {
        return new Call(Form.DELETE, ref);
    }

    public static Call createCollection(Expr params) {
        return new Call(Form.CREATE_COLLECTION, params);
    }

    public static Call createIndex(Expr params) {
        return new Call(Form.CREATE_INDEX, params);
    }
}
