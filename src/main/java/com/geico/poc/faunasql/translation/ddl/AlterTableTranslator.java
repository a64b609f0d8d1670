package com.geico.poc.faunasql.translation.ddl;

import com.geico.poc.faunasql.errors.TranslationRejectedException;
import com.geico.poc.faunasql.fql.Expr;
import com.geico.poc.faunasql.fql.Fql;
import com.geico.poc.faunasql.schema.InformationSchema;
import com.geico.poc.faunasql.sql.ParsedStatement;
import com.geico.poc.faunasql.translation.CompiledStatement;
import com.geico.poc.faunasql.translation.SchemaQueries;

import java.util.Collections;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.geico.poc.faunasql.fql.Fql.collection;
import static com.geico.poc.faunasql.fql.Fql.exists;
import static com.geico.poc.faunasql.fql.Fql.lambda;
import static com.geico.poc.faunasql.fql.Fql.obj;
import static com.geico.poc.faunasql.fql.Fql.path;
import static com.geico.poc.faunasql.fql.Fql.var;

/**
 * ALTER TABLE t ALTER [COLUMN] c DROP DEFAULT. No other alteration is supported.
 */
class AlterTableTranslator {

    private static final Pattern DROP_DEFAULT = Pattern.compile(
        "(?is)^ALTER\\s+TABLE\\s+\"?(\\w+)\"?\\s+ALTER\\s+(?:COLUMN\\s+)?\"?(\\w+)\"?\\s+DROP\\s+DEFAULT\\s*$");

    private final int pageSize;

    AlterTableTranslator(int pageSize) {
        this.pageSize = pageSize;
    }

    CompiledStatement translate(ParsedStatement statement) {
        Matcher matcher = DROP_DEFAULT.matcher(statement.getSql().trim());
        if (!matcher.matches()) {
            throw new TranslationRejectedException(
                "Only ALTER TABLE ... ALTER COLUMN ... DROP DEFAULT is supported: " + statement.getSql());
        }
        String table = matcher.group(1);
        String column = matcher.group(2);

        Expr columnDocuments = Fql.select(path("data"), Fql.paginate(
            InformationSchemaDocuments.documentsWhere(InformationSchema.COLUMNS, "table_name_", table, "name_", column),
            pageSize));
        Expr dropDocumentDefaults = Fql.ifElse(exists(collection(InformationSchema.COLUMNS)),
            Fql.foreach(lambda("ref", Fql.update(var("ref"), obj("data", obj("default_", null)))), columnDocuments),
            Fql.NULL);

        Expr alter = Fql.sequence(
            FieldMetadataUpdates.setField(table, column, "default", null),
            dropDocumentDefaults,
            SchemaQueries.singleRow("id", table));
        return new CompiledStatement(ParsedStatement.Type.ALTER_TABLE, Collections.singletonList(alter), null, null);
    }
}
