package com.geico.poc.faunasql.schema;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Collections that describe user tables so they can be introspected with plain SQL.
 */
public final class InformationSchema {

    public static final String TABLES = "information_schema_tables_";
    public static final String COLUMNS = "information_schema_columns_";
    public static final String INDEXES = "information_schema_indexes_";

    public static final List<String> COLLECTIONS =
        Collections.unmodifiableList(Arrays.asList(TABLES, COLUMNS, INDEXES));

    private static final List<FieldMetadata> TABLE_FIELDS = Arrays.asList(
        field("name_", DataTypes.STRING, true));

    private static final List<FieldMetadata> COLUMN_FIELDS = Arrays.asList(
        field("table_name_", DataTypes.STRING, false),
        field("name_", DataTypes.STRING, false),
        field("type_", DataTypes.STRING, false),
        field("nullable_", DataTypes.BOOLEAN, false),
        field("default_", DataTypes.STRING, false),
        field("unique_", DataTypes.BOOLEAN, false));

    private static final List<FieldMetadata> INDEX_FIELDS = Arrays.asList(
        field("table_name_", DataTypes.STRING, false),
        field("name_", DataTypes.STRING, false),
        field("column_names_", DataTypes.STRING, false),
        field("unique_", DataTypes.BOOLEAN, false),
        field("constrained_columns_", DataTypes.STRING, false),
        field("referred_table_", DataTypes.STRING, false),
        field("referred_columns_", DataTypes.STRING, false));

    private InformationSchema() {
    }

    public static List<FieldMetadata> fieldsOf(String collection) {
        switch (collection) {
            case TABLES:
                return TABLE_FIELDS;
            case COLUMNS:
                return COLUMN_FIELDS;
            case INDEXES:
                return INDEX_FIELDS;
            default:
                throw new IllegalArgumentException("Not an information schema collection: " + collection);
        }
    }

    public static boolean isInformationSchema(String collection) {
        return COLLECTIONS.contains(collection);
    }

    private static FieldMetadata field(String name, String type, boolean unique) {
        return new FieldMetadata(name, type, unique, false, null, null);
    }
}
