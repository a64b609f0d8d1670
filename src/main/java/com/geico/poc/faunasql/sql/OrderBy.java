package com.geico.poc.faunasql.sql;

import com.geico.poc.faunasql.errors.TranslationRejectedException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class OrderBy {

    private final List<Column> columns;
    private final Direction direction;

    public OrderBy(List<Column> columns, Direction direction) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("ORDER BY needs at least one column");
        }
        if (columns.size() > 1) {
            throw new TranslationRejectedException("Ordering by multiple columns is not supported");
        }
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.direction = direction != null ? direction : Direction.ASC;
    }

    public List<Column> getColumns() {
        return columns;
    }

    public Column getColumn() {
        return columns.get(0);
    }

    public Direction getDirection() {
        return direction;
    }

    @Override
    public String toString() {
        return "ORDER BY " + columns + " " + direction;
    }
}
