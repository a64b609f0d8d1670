package com.geico.poc.faunasql.translation.dml;

import com.geico.poc.faunasql.errors.TranslationRejectedException;
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

import static com.geico.poc.faunasql.fql.Fql.lambda;
import static com.geico.poc.faunasql.fql.Fql.let;
import static com.geico.poc.faunasql.fql.Fql.obj;
import static com.geico.poc.faunasql.fql.Fql.var;

class UpdateTranslator {

    private final int pageSize;

    UpdateTranslator(int pageSize) {
        this.pageSize = pageSize;
    }

    CompiledStatement translate(SQLQuery query) {
        if (query.isJoined()) {
            throw new TranslationRejectedException("UPDATE with JOIN is not supported");
        }
        Table table = query.getPrincipalTable();

        Map<String, Expr> data = new LinkedHashMap<>();
        for (Column column : table.getColumns()) {
            Expr value = Fql.value(column.getValue());
            Expr references = SchemaQueries.referencesOf(column.getName(), var("fields"));
            data.put(column.getName(), let("references", references,
                Fql.ifElse(Fql.isNull(var("references")),
                    value,
                    SchemaQueries.foreignRef(Fql.value(SchemaQueries.idOf(column.getValue())), var("references")))));
        }

        Map<String, Expr> bindings = new LinkedHashMap<>();
        bindings.put("refs", new RowPipeline(query, pageSize).principalRefs());
        bindings.put("count", Fql.count(var("refs")));
        bindings.put("fields", SchemaQueries.fieldsOf(table.getName()));
        bindings.put("updated", Fql.foreach(
            lambda("ref", Fql.update(var("ref"), obj("data", obj(data)))),
            var("refs")));

        return CompiledStatement.single(ParsedStatement.Type.UPDATE,
            let(bindings, SchemaQueries.singleRow("count", var("count"))), null);
    }
}
