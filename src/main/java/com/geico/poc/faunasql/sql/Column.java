package com.geico.poc.faunasql.sql;

import java.util.Objects;

/**
 * A column as used by one statement: selected, assigned, filtered on or ordered by.
 *
 * The primary key is called {@code id} in SQL and {@code ref} in the store; {@link #getName()}
 * returns the store name, {@link #getSqlName()} the SQL one.
 */
public class Column {

    public static final String ID = "id";
    public static final String REF = "ref";

    private final String tableName;
    private final String name;
    private final String alias;
    private final int position;
    private final SqlFunction function;
    private final Object value;

    public Column(String tableName, String sqlName, String alias, int position,
                  SqlFunction function, Object value) {
        if (sqlName == null || sqlName.isEmpty()) {
            throw new IllegalArgumentException("Column name is required");
        }
        this.tableName = tableName;
        this.name = ID.equals(sqlName) ? REF : sqlName;
        this.alias = alias != null ? alias : defaultAlias(sqlName, function);
        this.position = position;
        this.function = function;
        this.value = value;
    }

    public static Column named(String tableName, String sqlName) {
        return new Column(tableName, sqlName, null, 0, null, null);
    }

    public static Column selected(String tableName, String sqlName, String alias, int position,
                                  SqlFunction function) {
        return new Column(tableName, sqlName, alias, position, function, null);
    }

    public static Column assigned(String tableName, String sqlName, int position, Object value) {
        return new Column(tableName, sqlName, null, position, null, value);
    }

    private static String defaultAlias(String sqlName, SqlFunction function) {
        if (function != null) {
            return function.name().toLowerCase();
        }
        return sqlName;
    }

    public String getTableName() {
        return tableName;
    }

    /**
     * Field name in the store; {@code ref} for the primary key.
     */
    public String getName() {
        return name;
    }

    public String getSqlName() {
        return isPrimaryKey() ? ID : name;
    }

    public String getAlias() {
        return alias;
    }

    public int getPosition() {
        return position;
    }

    public SqlFunction getFunction() {
        return function;
    }

    public Object getValue() {
        return value;
    }

    public boolean isPrimaryKey() {
        return REF.equals(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Column column = (Column) o;
        return position == column.position && Objects.equals(tableName, column.tableName)
            && Objects.equals(name, column.name) && Objects.equals(alias, column.alias)
            && function == column.function && Objects.equals(value, column.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableName, name, alias, position, function, value);
    }

    @Override
    public String toString() {
        String qualified = (tableName != null ? tableName + "." : "") + getSqlName();
        if (function != null) {
            qualified = function + "(" + qualified + ")";
        }
        return qualified + (alias.equals(getSqlName()) ? "" : " AS " + alias);
    }
}
