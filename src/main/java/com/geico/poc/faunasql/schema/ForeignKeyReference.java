package com.geico.poc.faunasql.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Target of a foreign key. Only the referenced table's {@code id} can be targeted.
 */
public class ForeignKeyReference {

    private final String table;
    private final String column;

    @JsonCreator
    public ForeignKeyReference(
            @JsonProperty("table") String table,
            @JsonProperty("column") String column) {
        this.table = table;
        this.column = column;
    }

    public String getTable() {
        return table;
    }

    public String getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ForeignKeyReference that = (ForeignKeyReference) o;
        return Objects.equals(table, that.table) && Objects.equals(column, that.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, column);
    }

    @Override
    public String toString() {
        return table + "(" + column + ")";
    }
}
