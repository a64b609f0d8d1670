package com.geico.poc.faunasql.sql;

import org.apache.calcite.sql.SqlNode;

/**
 * One SQL statement after classification. DML and DROP TABLE carry the Calcite tree;
 * the other DDL statements are translated from their text.
 */
public class ParsedStatement {

    public enum Type {
        SELECT, INSERT, UPDATE, DELETE, CREATE_TABLE, CREATE_INDEX, ALTER_TABLE, DROP_TABLE;

        public boolean isDdl() {
            return this == CREATE_TABLE || this == CREATE_INDEX || this == ALTER_TABLE || this == DROP_TABLE;
        }
    }

    private final Type type;
    private final String sql;
    private final SqlNode node;

    public ParsedStatement(Type type, String sql, SqlNode node) {
        this.type = type;
        this.sql = sql;
        this.node = node;
    }

    public Type getType() {
        return type;
    }

    public String getSql() {
        return sql;
    }

    /**
     * Calcite parse tree, or null for statements translated from text.
     */
    public SqlNode getNode() {
        return node;
    }

    @Override
    public String toString() {
        return type + ": " + sql;
    }
}
