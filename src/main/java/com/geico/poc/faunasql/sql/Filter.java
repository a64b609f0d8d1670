package com.geico.poc.faunasql.sql;

import com.geico.poc.faunasql.errors.TranslationRejectedException;

import java.util.Objects;

/**
 * One WHERE comparison, normalized to "column op value".
 */
public class Filter {

    private final Column column;
    private final Comparison comparison;
    private final Object value;

    public Filter(Column column, Comparison comparison, Object value) {
        if (column.getTableName() == null) {
            throw new IllegalArgumentException("Filter column must belong to a table: " + column);
        }
        if (value == null && comparison != Comparison.EQUAL) {
            throw new TranslationRejectedException(
                "Only equality comparisons with NULL are supported, got " + column + " " + comparison.getSymbol() + " NULL");
        }
        this.column = column;
        this.comparison = comparison;
        this.value = value;
    }

    /**
     * Builds the filter for a comparison written as {@code value op column}, flipping the operator.
     */
    public static Filter valueFirst(Object value, Comparison comparison, Column column) {
        return new Filter(column, comparison.flip(), value);
    }

    public static Filter isNull(Column column) {
        return new Filter(column, Comparison.EQUAL, null);
    }

    public Column getColumn() {
        return column;
    }

    public String getTableName() {
        return column.getTableName();
    }

    public Comparison getComparison() {
        return comparison;
    }

    public Object getValue() {
        return value;
    }

    public boolean isNullCheck() {
        return value == null;
    }

    /**
     * Identifier of the filter: {@code table_column_op_value}.
     */
    public String getName() {
        return getTableName() + "_" + column.getName() + "_" + comparison.getSymbol() + "_" + value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Filter filter = (Filter) o;
        return Objects.equals(column.getTableName(), filter.column.getTableName())
            && Objects.equals(column.getName(), filter.column.getName())
            && comparison == filter.comparison && Objects.equals(value, filter.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column.getTableName(), column.getName(), comparison, value);
    }

    @Override
    public String toString() {
        return getTableName() + "." + column.getSqlName() + " "
            + (value == null ? "IS NULL" : comparison.getSymbol() + " " + value);
    }
}
