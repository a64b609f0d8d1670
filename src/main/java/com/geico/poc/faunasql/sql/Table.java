package com.geico.poc.faunasql.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A table referenced by a statement, with the columns the statement reads or writes on it.
 */
public class Table {

    private final String name;
    private final String alias;
    private final List<Column> columns;
    private final TableJoin join;

    public Table(String name, String alias, List<Column> columns, TableJoin join) {
        this.name = Objects.requireNonNull(name, "table name");
        this.alias = alias;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.join = join;
    }

    public String getName() {
        return name;
    }

    public String getAlias() {
        return alias;
    }

    public List<Column> getColumns() {
        return columns;
    }

    /**
     * Join back to an earlier table of the chain; null for the principal table.
     */
    public TableJoin getJoin() {
        return join;
    }

    @Override
    public String toString() {
        return name + (alias != null ? " AS " + alias : "") + (join != null ? " ON " + join : "");
    }
}
