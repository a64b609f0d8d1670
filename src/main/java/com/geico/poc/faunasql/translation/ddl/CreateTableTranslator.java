package com.geico.poc.faunasql.translation.ddl;

import com.geico.poc.faunasql.fql.Expr;
import com.geico.poc.faunasql.fql.Fql;
import com.geico.poc.faunasql.schema.IndexDefinition;
import com.geico.poc.faunasql.schema.IndexNames;
import com.geico.poc.faunasql.schema.InformationSchema;
import com.geico.poc.faunasql.sql.ParsedStatement;
import com.geico.poc.faunasql.translation.CompiledStatement;
import com.geico.poc.faunasql.translation.SchemaQueries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.geico.poc.faunasql.fql.Fql.collection;
import static com.geico.poc.faunasql.fql.Fql.exists;
import static com.geico.poc.faunasql.fql.Fql.ifElse;

/**
 * CREATE TABLE runs as four store calls, since the store provisions collections
 * asynchronously and an index can only be built on a collection that already exists:
 * information-schema collections, their indexes, the table's collection, then the table's
 * indexes together with its information-schema documents.
 */
class CreateTableTranslator {

    private static final Logger log = LoggerFactory.getLogger(CreateTableTranslator.class);

    CompiledStatement translate(ParsedStatement statement) {
        TableDefinition table = ColumnDefinitionParser.parse(statement.getSql());
        String name = table.getName();
        List<IndexDefinition> indexes = IndexDefinition.forTable(name, table.getFields());
        log.info("Creating table {} with {} fields and {} indexes", name, table.getFields().size(), indexes.size());

        Expr createCollection = Fql.createCollection(InformationSchemaDocuments.collectionParams(name, table.getFields()));
        if (table.isIfNotExists()) {
            createCollection = ifElse(exists(collection(name)), Fql.NULL, createCollection);
        }

        Expr result = SchemaQueries.singleRow("id", name);
        List<Expr> provisioning = new ArrayList<>();
        for (IndexDefinition index : indexes) {
            provisioning.add(Fql.createIndex(index.toExpr()));
        }
        if (!InformationSchema.isInformationSchema(name)) {
            provisioning.addAll(InformationSchemaDocuments.describe(name, table.getFields(), indexes));
        }
        provisioning.add(result);

        Expr createIndexes = Fql.sequence(provisioning);
        if (table.isIfNotExists()) {
            createIndexes = ifElse(exists(Fql.index(IndexNames.indexName(name))), result, createIndexes);
        }

        return new CompiledStatement(ParsedStatement.Type.CREATE_TABLE,
            Arrays.asList(
                InformationSchemaDocuments.ensureCollections(),
                InformationSchemaDocuments.ensureIndexes(),
                createCollection,
                createIndexes),
            null, null);
    }
}
