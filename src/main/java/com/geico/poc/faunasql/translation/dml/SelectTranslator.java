package com.geico.poc.faunasql.translation.dml;

import com.geico.poc.faunasql.fql.Expr;
import com.geico.poc.faunasql.fql.Fql;
import com.geico.poc.faunasql.sql.Column;
import com.geico.poc.faunasql.sql.ParsedStatement;
import com.geico.poc.faunasql.sql.SQLQuery;
import com.geico.poc.faunasql.sql.SqlFunction;
import com.geico.poc.faunasql.translation.CompiledStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.geico.poc.faunasql.fql.Fql.arr;
import static com.geico.poc.faunasql.fql.Fql.lambda;
import static com.geico.poc.faunasql.fql.Fql.path;
import static com.geico.poc.faunasql.fql.Fql.select;
import static com.geico.poc.faunasql.fql.Fql.var;

class SelectTranslator {

    private final int pageSize;

    SelectTranslator(int pageSize) {
        this.pageSize = pageSize;
    }

    CompiledStatement translate(SQLQuery query) {
        Map<String, Expr> bindings = new LinkedHashMap<>();
        RowPipeline pipeline = new RowPipeline(query, pageSize);
        bindings.put("rows", pipeline.rows());

        Expr selected = var("rows");
        if (query.hasFunctions()) {
            // aggregates collapse the result to a single row, even over no documents
            selected = Fql.ifElse(Fql.isEmpty(var("rows")), arr(Fql.obj()), Fql.take(1, var("rows")));
        }

        List<Expr> pairs = new ArrayList<>();
        for (Column column : query.getColumns()) {
            pairs.add(arr(Fql.value(column.getAlias()), columnValue(column)));
        }
        Expr result = Fql.map(lambda("row", arr(pairs)), selected);
        if (query.isDistinct()) {
            result = Fql.distinct(result);
        }

        Integer limit = query.hasFunctions() ? null : query.getLimit();
        return new CompiledStatement(ParsedStatement.Type.SELECT,
            Collections.singletonList(Fql.let(bindings, result)), query.getColumnAliases(), limit,
            pipeline.joinKeyChecks());
    }

    private Expr columnValue(Column column) {
        if (column.getFunction() == SqlFunction.COUNT) {
            return Fql.count(var("rows"));
        }
        return select(path(column.getTableName(), column.getName()), var("row"), Fql.NULL);
    }
}
