package com.geico.poc.faunasql.translation;

import com.geico.poc.faunasql.fql.Expr;
import com.geico.poc.faunasql.fql.Fql;

import java.util.ArrayList;
import java.util.List;

import static com.geico.poc.faunasql.fql.Fql.arr;
import static com.geico.poc.faunasql.fql.Fql.collection;
import static com.geico.poc.faunasql.fql.Fql.eq;
import static com.geico.poc.faunasql.fql.Fql.filter;
import static com.geico.poc.faunasql.fql.Fql.get;
import static com.geico.poc.faunasql.fql.Fql.ifElse;
import static com.geico.poc.faunasql.fql.Fql.isNull;
import static com.geico.poc.faunasql.fql.Fql.lambda;
import static com.geico.poc.faunasql.fql.Fql.or;
import static com.geico.poc.faunasql.fql.Fql.path;
import static com.geico.poc.faunasql.fql.Fql.ref;
import static com.geico.poc.faunasql.fql.Fql.select;
import static com.geico.poc.faunasql.fql.Fql.var;

/**
 * Expressions that read table schema stored on the collection document at query time.
 */
public final class SchemaQueries {

    private SchemaQueries() {
    }

    /**
     * The table's field metadata array, empty if the collection has none.
     */
    public static Expr fieldsOf(String table) {
        return select(path("data", "metadata", "fields"), get(collection(table)), Fql.emptyArray());
    }

    /**
     * Foreign-key target ({@code {table, column}}) of {@code column}, or null.
     */
    public static Expr referencesOf(String column, Expr fields) {
        return select(
            path(0, "references"),
            filter(lambda("field", eq(select(path("name"), var("field")), Fql.value(column))), fields),
            Fql.NULL);
    }

    /**
     * Ref to the document with id {@code id} in the referenced table; null when either is blank.
     */
    public static Expr foreignRef(Expr id, Expr references) {
        return ifElse(
            or(isNull(id), isNull(references)),
            Fql.NULL,
            ref(collection(select(path("table"), references)), id));
    }

    /**
     * Store ids are strings; numeric literals compared against refs are converted.
     */
    public static Object idOf(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    /**
     * A statement result holding one row made of the given name/value pairs.
     */
    public static Expr singleRow(Object... namesAndValues) {
        List<Expr> pairs = new ArrayList<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            pairs.add(arr(Fql.value(namesAndValues[i]), Fql.value(namesAndValues[i + 1])));
        }
        return arr(arr(pairs));
    }
}
