package com.geico.poc.faunasql.translation.ddl;

import com.geico.poc.faunasql.fql.Expr;
import com.geico.poc.faunasql.fql.Fql;
import com.geico.poc.faunasql.translation.SchemaQueries;

import static com.geico.poc.faunasql.fql.Fql.collection;
import static com.geico.poc.faunasql.fql.Fql.lambda;
import static com.geico.poc.faunasql.fql.Fql.obj;
import static com.geico.poc.faunasql.fql.Fql.path;
import static com.geico.poc.faunasql.fql.Fql.select;
import static com.geico.poc.faunasql.fql.Fql.var;

/**
 * Rewrites one entry of a collection's stored field metadata.
 */
final class FieldMetadataUpdates {

    private FieldMetadataUpdates() {
    }

    static Expr setField(String table, String fieldName, String key, Object value) {
        Expr rewritten = Fql.map(
            lambda("field", Fql.ifElse(
                Fql.eq(select(path("name"), var("field")), Fql.value(fieldName)),
                Fql.merge(var("field"), obj(key, value)),
                var("field"))),
            SchemaQueries.fieldsOf(table));
        return Fql.update(collection(table), obj("data", obj("metadata", obj("fields", rewritten))));
    }
}
