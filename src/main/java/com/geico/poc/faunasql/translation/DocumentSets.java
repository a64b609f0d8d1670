package com.geico.poc.faunasql.translation;

import com.geico.poc.faunasql.errors.TranslationRejectedException;
import com.geico.poc.faunasql.fql.Expr;
import com.geico.poc.faunasql.fql.Fql;
import com.geico.poc.faunasql.schema.IndexKind;
import com.geico.poc.faunasql.schema.IndexNames;
import com.geico.poc.faunasql.sql.Comparison;
import com.geico.poc.faunasql.sql.Filter;
import com.geico.poc.faunasql.sql.SetOperation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.geico.poc.faunasql.fql.Fql.arr;
import static com.geico.poc.faunasql.fql.Fql.collection;
import static com.geico.poc.faunasql.fql.Fql.difference;
import static com.geico.poc.faunasql.fql.Fql.exists;
import static com.geico.poc.faunasql.fql.Fql.ifElse;
import static com.geico.poc.faunasql.fql.Fql.index;
import static com.geico.poc.faunasql.fql.Fql.join;
import static com.geico.poc.faunasql.fql.Fql.lambda;
import static com.geico.poc.faunasql.fql.Fql.let;
import static com.geico.poc.faunasql.fql.Fql.match;
import static com.geico.poc.faunasql.fql.Fql.range;
import static com.geico.poc.faunasql.fql.Fql.ref;
import static com.geico.poc.faunasql.fql.Fql.singleton;
import static com.geico.poc.faunasql.fql.Fql.var;

/**
 * Compiles WHERE filters into sets of document refs, choosing an index per comparison.
 *
 * <ul>
 *   <li>{@code id = v}: the document ref itself</li>
 *   <li>{@code fk = v}: the foreign-key ref index, when the field is a foreign key</li>
 *   <li>{@code f = v}: the term index, when the field has one</li>
 *   <li>anything else: a range over the value index</li>
 * </ul>
 * Index existence is checked by the store when the query runs, since translation never
 * reads the schema.
 */
public final class DocumentSets {

    private DocumentSets() {
    }

    /**
     * Refs matching all (INTERSECTION) or any (UNION) of the filters; every ref of the table
     * when there are none.
     */
    public static Expr forFilters(String table, List<Filter> filters, SetOperation operation) {
        if (filters.isEmpty()) {
            return match(index(IndexNames.indexName(table)));
        }
        if (filters.size() == 1) {
            return forFilter(filters.get(0));
        }
        List<Expr> sets = new ArrayList<>();
        for (Filter filter : filters) {
            sets.add(forFilter(filter));
        }
        return operation == SetOperation.UNION ? Fql.union(sets) : Fql.intersection(sets);
    }

    public static Expr forFilter(Filter filter) {
        String table = filter.getTableName();
        String field = filter.getColumn().getName();

        if (filter.getColumn().isPrimaryKey()) {
            return primaryKeySet(filter);
        }

        Expr value = Fql.value(filter.getValue());
        Expr valueIndex = match(index(IndexNames.indexName(table, field, IndexKind.VALUE)));
        Expr equalityRange = range(valueIndex, arr(value), arr(value));

        if (filter.isNullCheck()) {
            // term and ref indexes never hold null terms
            return toRefSet(table, equalityRange);
        }

        switch (filter.getComparison()) {
            case EQUAL:
                return equalitySet(table, field, filter.getValue(), equalityRange);
            case GREATER_THAN_OR_EQUAL:
                return toRefSet(table, range(valueIndex, arr(value), Fql.emptyArray()));
            case GREATER_THAN:
                return toRefSet(table, difference(range(valueIndex, arr(value), Fql.emptyArray()), equalityRange));
            case LESS_THAN_OR_EQUAL:
                return toRefSet(table, difference(range(valueIndex, Fql.emptyArray(), arr(value)), nullRange(valueIndex)));
            case LESS_THAN:
                return toRefSet(table, difference(
                    range(valueIndex, Fql.emptyArray(), arr(value)), equalityRange, nullRange(valueIndex)));
            default:
                throw new TranslationRejectedException("Unsupported comparison: " + filter);
        }
    }

    private static Expr primaryKeySet(Filter filter) {
        if (filter.isNullCheck()) {
            throw new TranslationRejectedException("The id column is never null: " + filter);
        }
        if (filter.getComparison() != Comparison.EQUAL) {
            throw new TranslationRejectedException("Only equality comparisons are supported on id: " + filter);
        }
        Expr documentRef = ref(collection(filter.getTableName()), Fql.value(SchemaQueries.idOf(filter.getValue())));
        return Fql.filter(lambda("ref", exists(var("ref"))), singleton(documentRef));
    }

    private static Expr equalitySet(String table, String field, Object value, Expr equalityRange) {
        Map<String, Expr> bindings = new LinkedHashMap<>();
        bindings.put("ref_index", index(IndexNames.indexName(table, field, IndexKind.REF, field)));
        bindings.put("term_index", index(IndexNames.indexName(table, field, IndexKind.TERM)));
        bindings.put("comparison_value", Fql.value(value));

        Expr foreignKeyMatch = let(
            "references", SchemaQueries.referencesOf(field, SchemaQueries.fieldsOf(table)),
            toRefSet(table, match(var("ref_index"),
                SchemaQueries.foreignRef(Fql.value(SchemaQueries.idOf(value)), var("references")))));

        return let(bindings,
            ifElse(exists(var("ref_index")),
                foreignKeyMatch,
                ifElse(exists(var("term_index")),
                    match(var("term_index"), var("comparison_value")),
                    toRefSet(table, equalityRange))));
    }

    private static Expr nullRange(Expr valueIndex) {
        return range(valueIndex, arr(Fql.NULL), arr(Fql.NULL));
    }

    /**
     * Turns a set of {@code [value, ref]} index entries back into document refs.
     */
    public static Expr toRefSet(String table, Expr entries) {
        return join(entries, lambda(Arrays.asList("value", "ref"),
            match(index(IndexNames.indexName(table, IndexKind.REF)), var("ref"))));
    }
}
