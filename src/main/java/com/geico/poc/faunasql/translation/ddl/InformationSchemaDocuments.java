package com.geico.poc.faunasql.translation.ddl;

import com.geico.poc.faunasql.fql.Expr;
import com.geico.poc.faunasql.fql.Fql;
import com.geico.poc.faunasql.schema.DataTypes;
import com.geico.poc.faunasql.schema.FieldMetadata;
import com.geico.poc.faunasql.schema.IndexDefinition;
import com.geico.poc.faunasql.schema.IndexKind;
import com.geico.poc.faunasql.schema.IndexNames;
import com.geico.poc.faunasql.schema.InformationSchema;
import com.geico.poc.faunasql.sql.Column;
import com.geico.poc.faunasql.sql.Comparison;
import com.geico.poc.faunasql.sql.Filter;
import com.geico.poc.faunasql.sql.SetOperation;
import com.geico.poc.faunasql.translation.DocumentSets;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.geico.poc.faunasql.fql.Fql.collection;
import static com.geico.poc.faunasql.fql.Fql.exists;
import static com.geico.poc.faunasql.fql.Fql.ifElse;
import static com.geico.poc.faunasql.fql.Fql.obj;

/**
 * Writes and removes the information-schema documents describing user tables.
 */
final class InformationSchemaDocuments {

    private InformationSchemaDocuments() {
    }

    /**
     * Creates each information-schema collection that does not exist yet.
     */
    static Expr ensureCollections() {
        List<Expr> creations = new ArrayList<>();
        for (String name : InformationSchema.COLLECTIONS) {
            creations.add(ifElse(exists(collection(name)), Fql.NULL,
                Fql.createCollection(collectionParams(name, InformationSchema.fieldsOf(name)))));
        }
        return Fql.sequence(creations);
    }

    /**
     * Creates each missing index of the information-schema collections. Runs as its own call,
     * after the collections are provisioned.
     */
    static Expr ensureIndexes() {
        List<Expr> creations = new ArrayList<>();
        for (String name : InformationSchema.COLLECTIONS) {
            for (IndexDefinition index : IndexDefinition.forTable(name, InformationSchema.fieldsOf(name))) {
                creations.add(ifElse(exists(Fql.index(index.getName())), Fql.NULL, Fql.createIndex(index.toExpr())));
            }
        }
        return Fql.sequence(creations);
    }

    static Expr collectionParams(String name, List<FieldMetadata> fields) {
        List<Expr> fieldExprs = new ArrayList<>();
        for (FieldMetadata field : fields) {
            fieldExprs.add(field.toExpr());
        }
        return obj("name", name, "data", obj("metadata", obj("fields", Fql.arr(fieldExprs))));
    }

    /**
     * Documents for the table, each of its columns and each of its indexes.
     */
    static List<Expr> describe(String table, List<FieldMetadata> fields, List<IndexDefinition> indexes) {
        List<Expr> creations = new ArrayList<>();
        creations.add(create(InformationSchema.TABLES, obj("name_", table)));

        creations.add(create(InformationSchema.COLUMNS, obj(
            "table_name_", table,
            "name_", Column.ID,
            "type_", DataTypes.INTEGER,
            "nullable_", false,
            "default_", null,
            "unique_", true)));
        for (FieldMetadata field : fields) {
            creations.add(create(InformationSchema.COLUMNS, columnDocument(table, field)));
        }
        for (IndexDefinition index : indexes) {
            creations.add(create(InformationSchema.INDEXES, indexDocument(table, fields, index)));
        }
        return creations;
    }

    static Expr columnDocument(String table, FieldMetadata field) {
        return obj(
            "table_name_", table,
            "name_", field.getName(),
            "type_", field.getType(),
            "nullable_", !field.isNotNull(),
            "default_", field.getDefaultValue(),
            "unique_", field.isUnique());
    }

    static Expr indexDocument(String table, List<FieldMetadata> fields, IndexDefinition index) {
        Set<String> columns = new LinkedHashSet<>();
        for (List<String> path : index.getTerms()) {
            columns.add(columnName(path));
        }
        for (List<String> path : index.getValues()) {
            columns.add(columnName(path));
        }
        columns.add(Column.ID);

        FieldMetadata constrained = null;
        for (FieldMetadata field : fields) {
            String refIndex = IndexNames.indexName(table, field.getName(), IndexKind.REF);
            if (field.isForeignKey()
                && (index.getName().equals(refIndex) || index.getName().startsWith(refIndex + "_to_"))) {
                constrained = field;
            }
        }

        return obj(
            "table_name_", table,
            "name_", index.getName(),
            "column_names_", String.join(",", columns),
            "unique_", index.isUnique(),
            "constrained_columns_", constrained == null ? null : constrained.getName(),
            "referred_table_", constrained == null ? null : constrained.getReferences().getTable(),
            "referred_columns_", constrained == null ? null : constrained.getReferences().getColumn());
    }

    private static String columnName(List<String> path) {
        String last = path.get(path.size() - 1);
        return Column.REF.equals(last) ? Column.ID : last;
    }

    /**
     * Refs of the information-schema documents whose {@code field} equals {@code value}.
     */
    static Expr documentsWhere(String collection, String field, Object value) {
        return DocumentSets.forFilters(collection,
            Arrays.asList(new Filter(Column.named(collection, field), Comparison.EQUAL, value)),
            SetOperation.INTERSECTION);
    }

    static Expr documentsWhere(String collection, String field, Object value, String otherField, Object otherValue) {
        return DocumentSets.forFilters(collection,
            Arrays.asList(
                new Filter(Column.named(collection, field), Comparison.EQUAL, value),
                new Filter(Column.named(collection, otherField), Comparison.EQUAL, otherValue)),
            SetOperation.INTERSECTION);
    }

    private static Expr create(String collection, Expr data) {
        return Fql.create(Fql.collection(collection), obj("data", data));
    }
}
