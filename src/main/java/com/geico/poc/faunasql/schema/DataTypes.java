package com.geico.poc.faunasql.schema;

import com.geico.poc.faunasql.errors.TranslationRejectedException;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps SQL column types to the type names recorded in field metadata.
 */
public final class DataTypes {

    public static final String STRING = "String";
    public static final String INTEGER = "Integer";
    public static final String FLOAT = "Float";
    public static final String BOOLEAN = "Boolean";
    public static final String DATE = "Date";
    public static final String TIMESTAMP = "TimeStamp";

    private static final Map<String, String> SQL_TYPES = new HashMap<>();

    static {
        for (String type : new String[] {"CHAR", "CHARACTER", "VARCHAR", "NCHAR", "NVARCHAR", "TEXT", "CLOB", "UUID"}) {
            SQL_TYPES.put(type, STRING);
        }
        for (String type : new String[] {"INT", "INTEGER", "BIGINT", "SMALLINT", "TINYINT"}) {
            SQL_TYPES.put(type, INTEGER);
        }
        for (String type : new String[] {"FLOAT", "DOUBLE", "REAL", "DECIMAL", "NUMERIC"}) {
            SQL_TYPES.put(type, FLOAT);
        }
        SQL_TYPES.put("BOOL", BOOLEAN);
        SQL_TYPES.put("BOOLEAN", BOOLEAN);
        SQL_TYPES.put("DATE", DATE);
        SQL_TYPES.put("DATETIME", TIMESTAMP);
        SQL_TYPES.put("TIMESTAMP", TIMESTAMP);
        SQL_TYPES.put("TIME", STRING);
    }

    private DataTypes() {
    }

    /**
     * @param sqlType declared type, possibly with a length or precision such as {@code VARCHAR(255)}
     */
    public static String fromSql(String sqlType) {
        String base = sqlType.trim().toUpperCase();
        int paren = base.indexOf('(');
        if (paren > 0) {
            base = base.substring(0, paren).trim();
        }
        // DOUBLE PRECISION, CHARACTER VARYING
        int space = base.indexOf(' ');
        if (space > 0) {
            base = base.substring(0, space);
        }
        String type = SQL_TYPES.get(base);
        if (type == null) {
            throw new TranslationRejectedException("Unsupported column type: " + sqlType);
        }
        return type;
    }
}
