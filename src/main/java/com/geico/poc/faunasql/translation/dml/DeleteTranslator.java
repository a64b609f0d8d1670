package com.geico.poc.faunasql.translation.dml;

import com.geico.poc.faunasql.fql.Expr;
import com.geico.poc.faunasql.fql.Fql;
import com.geico.poc.faunasql.sql.ParsedStatement;
import com.geico.poc.faunasql.sql.SQLQuery;
import com.geico.poc.faunasql.translation.CompiledStatement;
import com.geico.poc.faunasql.translation.SchemaQueries;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.geico.poc.faunasql.fql.Fql.lambda;
import static com.geico.poc.faunasql.fql.Fql.path;
import static com.geico.poc.faunasql.fql.Fql.select;
import static com.geico.poc.faunasql.fql.Fql.var;

/**
 * Deletes the principal-table documents matched by the WHERE clause and reports how many.
 */
class DeleteTranslator {

    private final int pageSize;

    DeleteTranslator(int pageSize) {
        this.pageSize = pageSize;
    }

    CompiledStatement translate(SQLQuery query) {
        RowPipeline pipeline = new RowPipeline(query, pageSize);
        Expr refs;
        if (query.isJoined()) {
            String principal = query.getPrincipalTable().getName();
            refs = Fql.distinct(Fql.map(lambda("row", select(path(principal, "ref"), var("row"))), pipeline.rows()));
        } else {
            refs = pipeline.principalRefs();
        }

        Map<String, Expr> bindings = new LinkedHashMap<>();
        bindings.put("refs", refs);
        bindings.put("count", Fql.count(var("refs")));
        bindings.put("deleted", Fql.foreach(lambda("ref", Fql.delete(var("ref"))), var("refs")));

        return new CompiledStatement(ParsedStatement.Type.DELETE,
            Collections.singletonList(Fql.let(bindings, SchemaQueries.singleRow("count", var("count")))),
            null, null, pipeline.joinKeyChecks());
    }
}
