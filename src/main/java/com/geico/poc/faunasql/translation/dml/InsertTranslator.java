package com.geico.poc.faunasql.translation.dml;

import com.geico.poc.faunasql.fql.Expr;
import com.geico.poc.faunasql.fql.Fql;
import com.geico.poc.faunasql.sql.Column;
import com.geico.poc.faunasql.sql.ParsedStatement;
import com.geico.poc.faunasql.sql.SQLQuery;
import com.geico.poc.faunasql.sql.Table;
import com.geico.poc.faunasql.translation.CompiledStatement;
import com.geico.poc.faunasql.translation.SchemaQueries;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.geico.poc.faunasql.fql.Fql.arr;
import static com.geico.poc.faunasql.fql.Fql.collection;
import static com.geico.poc.faunasql.fql.Fql.lambda;
import static com.geico.poc.faunasql.fql.Fql.let;
import static com.geico.poc.faunasql.fql.Fql.obj;
import static com.geico.poc.faunasql.fql.Fql.path;
import static com.geico.poc.faunasql.fql.Fql.select;
import static com.geico.poc.faunasql.fql.Fql.var;

/**
 * Creates one document. Every declared field is written: provided values first, then column
 * defaults, then null. Foreign-key values become refs to the referenced document.
 */
class InsertTranslator {

    CompiledStatement translate(SQLQuery query) {
        Table table = query.getPrincipalTable();
        String name = table.getName();

        Map<String, Expr> provided = new LinkedHashMap<>();
        Map<String, Expr> providedIds = new LinkedHashMap<>();
        for (Column column : table.getColumns()) {
            provided.put(column.getName(), Fql.value(column.getValue()));
            providedIds.put(column.getName(), Fql.value(SchemaQueries.idOf(column.getValue())));
        }

        Map<String, Expr> bindings = new LinkedHashMap<>();
        bindings.put("fields", SchemaQueries.fieldsOf(name));
        bindings.put("provided", obj(provided));
        bindings.put("provided_ids", obj(providedIds));

        Expr fieldName = select(path("name"), var("field"));
        Expr raw = select(arr(fieldName), var("provided"), select(path("default"), var("field"), Fql.NULL));
        Expr rawId = select(arr(fieldName), var("provided_ids"), select(path("default"), var("field"), Fql.NULL));
        Expr fieldValue = let("references", select(path("references"), var("field"), Fql.NULL),
            Fql.ifElse(Fql.isNull(var("references")),
                raw,
                SchemaQueries.foreignRef(rawId, var("references"))));

        bindings.put("document", Fql.toObject(Fql.map(lambda("field", arr(fieldName, fieldValue)), var("fields"))));
        bindings.put("created", Fql.create(collection(name), obj("data", var("document"))));

        Expr storedPairs = Fql.map(
            lambda("field", arr(fieldName, select(arr(Fql.value("data"), fieldName), var("created"), Fql.NULL))),
            var("fields"));
        Expr row = Fql.append(storedPairs, arr(arr(Fql.value("id"), select(path("ref"), var("created")))));
        return CompiledStatement.single(ParsedStatement.Type.INSERT, let(bindings, arr(row)), null);
    }
}
