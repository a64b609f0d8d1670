package com.geico.poc.faunasql.client;

import com.geico.poc.faunasql.sql.ParsedStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rows returned by one statement. Each row is a tuple holding one value per column, in
 * column order; column names may repeat.
 */
public class QueryResult {

    private final ParsedStatement.Type type;
    private final List<String> columns;
    private final List<List<Object>> tuples;

    public QueryResult(ParsedStatement.Type type, List<String> columns, List<List<Object>> tuples) {
        this.type = type;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        List<List<Object>> copies = new ArrayList<>();
        for (List<Object> tuple : tuples) {
            if (tuple.size() != columns.size()) {
                throw new IllegalArgumentException(
                    "Row has " + tuple.size() + " values for " + columns.size() + " columns " + columns);
            }
            copies.add(Collections.unmodifiableList(new ArrayList<>(tuple)));
        }
        this.tuples = Collections.unmodifiableList(copies);
    }

    public ParsedStatement.Type getType() {
        return type;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<List<Object>> getTuples() {
        return tuples;
    }

    /**
     * Rows keyed by column name. Where a name repeats, only its first column is kept; use
     * {@link #getTuples()} to read every value.
     */
    public List<Map<String, Object>> getRows() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (List<Object> tuple : tuples) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                row.putIfAbsent(columns.get(i), tuple.get(i));
            }
            rows.add(row);
        }
        return rows;
    }

    public int size() {
        return tuples.size();
    }

    public boolean isEmpty() {
        return tuples.isEmpty();
    }

    /**
     * Values of the first column called {@code name}, across all rows.
     */
    public List<Object> column(String name) {
        int index = columns.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("No column " + name + " in " + columns);
        }
        List<Object> values = new ArrayList<>();
        for (List<Object> tuple : tuples) {
            values.add(tuple.get(index));
        }
        return values;
    }

    /**
     * Value of the first column called {@code name} in the first row, or null when there are no rows.
     */
    public Object first(String name) {
        return isEmpty() ? null : column(name).get(0);
    }

    @Override
    public String toString() {
        return "QueryResult{type=" + type + ", columns=" + columns + ", rows=" + tuples.size() + "}";
    }
}
