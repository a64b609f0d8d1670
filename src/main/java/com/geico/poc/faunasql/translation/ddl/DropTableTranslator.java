package com.geico.poc.faunasql.translation.ddl;

import com.geico.poc.faunasql.fql.Expr;
import com.geico.poc.faunasql.fql.Fql;
import com.geico.poc.faunasql.schema.InformationSchema;
import com.geico.poc.faunasql.sql.ParsedStatement;
import com.geico.poc.faunasql.translation.CompiledStatement;
import com.geico.poc.faunasql.translation.SchemaQueries;
import org.apache.calcite.sql.ddl.SqlDropTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;

import static com.geico.poc.faunasql.fql.Fql.collection;
import static com.geico.poc.faunasql.fql.Fql.exists;
import static com.geico.poc.faunasql.fql.Fql.lambda;
import static com.geico.poc.faunasql.fql.Fql.path;
import static com.geico.poc.faunasql.fql.Fql.var;

/**
 * DROP TABLE [IF EXISTS]. The store removes the collection's documents and indexes with it;
 * the table's information-schema documents are deleted here.
 */
class DropTableTranslator {

    private static final Logger log = LoggerFactory.getLogger(DropTableTranslator.class);

    private final int pageSize;

    DropTableTranslator(int pageSize) {
        this.pageSize = pageSize;
    }

    CompiledStatement translate(ParsedStatement statement) {
        SqlDropTable drop = (SqlDropTable) statement.getNode();
        String table = drop.name.names.get(drop.name.names.size() - 1);
        log.info("Dropping table {}", table);

        Expr result = SchemaQueries.singleRow("id", table);
        Expr dropTable = Fql.sequence(
            Fql.delete(collection(table)),
            Fql.ifElse(exists(collection(InformationSchema.TABLES)), deleteDescription(table), Fql.NULL),
            result);
        if (drop.ifExists) {
            dropTable = Fql.ifElse(exists(collection(table)), dropTable, result);
        }
        return new CompiledStatement(ParsedStatement.Type.DROP_TABLE, Collections.singletonList(dropTable), null, null);
    }

    private Expr deleteDescription(String table) {
        return Fql.sequence(
            deleteAll(InformationSchemaDocuments.documentsWhere(InformationSchema.TABLES, "name_", table)),
            deleteAll(InformationSchemaDocuments.documentsWhere(InformationSchema.COLUMNS, "table_name_", table)),
            deleteAll(InformationSchemaDocuments.documentsWhere(InformationSchema.INDEXES, "table_name_", table)));
    }

    private Expr deleteAll(Expr documents) {
        return Fql.foreach(lambda("ref", Fql.delete(var("ref"))),
            Fql.select(path("data"), Fql.paginate(documents, pageSize)));
    }
}
