package com.geico.poc.faunasql.translation.ddl;

import com.geico.poc.faunasql.errors.TranslationRejectedException;
import com.geico.poc.faunasql.fql.Expr;
import com.geico.poc.faunasql.fql.Fql;
import com.geico.poc.faunasql.schema.IndexDefinition;
import com.geico.poc.faunasql.schema.InformationSchema;
import com.geico.poc.faunasql.sql.Column;
import com.geico.poc.faunasql.sql.ParsedStatement;
import com.geico.poc.faunasql.translation.CompiledStatement;
import com.geico.poc.faunasql.translation.SchemaQueries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.geico.poc.faunasql.fql.Fql.collection;
import static com.geico.poc.faunasql.fql.Fql.exists;
import static com.geico.poc.faunasql.fql.Fql.ifElse;
import static com.geico.poc.faunasql.fql.Fql.obj;

/**
 * CREATE [UNIQUE] INDEX on one column. The index always gets the conventional term-index
 * name, so indexes created with the table are left alone.
 */
class CreateIndexTranslator {

    private static final Logger log = LoggerFactory.getLogger(CreateIndexTranslator.class);

    private static final Pattern CREATE_INDEX = Pattern.compile(
        "(?is)^CREATE\\s+(UNIQUE\\s+)?INDEX\\s+(IF\\s+NOT\\s+EXISTS\\s+)?\"?(\\w+)\"?\\s+ON\\s+\"?(\\w+)\"?\\s*\\(([^)]*)\\)\\s*$");

    CompiledStatement translate(ParsedStatement statement) {
        Matcher matcher = CREATE_INDEX.matcher(statement.getSql().trim());
        if (!matcher.matches()) {
            throw new TranslationRejectedException("Invalid CREATE INDEX syntax: " + statement.getSql());
        }
        boolean unique = matcher.group(1) != null;
        String table = matcher.group(4);

        String[] columns = matcher.group(5).split(",");
        if (columns.length != 1) {
            throw new TranslationRejectedException("Creating indexes for multiple columns is not supported");
        }
        String column = columns[0].trim().replace("\"", "");
        if (column.isEmpty() || Column.ID.equals(column)) {
            throw new TranslationRejectedException("Cannot create an index on column '" + column + "'");
        }

        IndexDefinition index = IndexDefinition.term(table, column, unique);
        log.info("Creating index {} (requested as {})", index.getName(), matcher.group(3));

        Expr result = SchemaQueries.singleRow("id", table);
        List<Expr> steps = new ArrayList<>();
        steps.add(Fql.createIndex(index.toExpr()));
        steps.add(ifElse(exists(collection(InformationSchema.INDEXES)),
            Fql.create(collection(InformationSchema.INDEXES), obj("data", obj(
                "table_name_", table,
                "name_", index.getName(),
                "column_names_", column + "," + Column.ID,
                "unique_", unique,
                "constrained_columns_", null,
                "referred_table_", null,
                "referred_columns_", null))),
            Fql.NULL));
        if (unique) {
            steps.add(FieldMetadataUpdates.setField(table, column, "unique", true));
        }
        steps.add(result);

        Expr create = ifElse(exists(Fql.index(index.getName())), result, Fql.sequence(steps));
        return new CompiledStatement(ParsedStatement.Type.CREATE_INDEX, Collections.singletonList(create), null, null);
    }
}
