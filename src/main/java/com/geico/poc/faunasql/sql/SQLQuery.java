package com.geico.poc.faunasql.sql;

import com.geico.poc.faunasql.errors.TranslationRejectedException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Normalized model of one SELECT, INSERT, UPDATE or DELETE statement.
 *
 * The first table is the principal table: the one after FROM, INTO or UPDATE. Every other
 * table was added by a JOIN.
 */
public class SQLQuery {

    private final List<Table> tables;
    private final List<FilterGroup> filterGroups;
    private final boolean distinct;
    private final OrderBy orderBy;
    private final Integer limit;

    public SQLQuery(List<Table> tables, List<FilterGroup> filterGroups, boolean distinct,
                    OrderBy orderBy, Integer limit) {
        if (tables.isEmpty()) {
            throw new IllegalArgumentException("A query needs at least one table");
        }
        this.tables = Collections.unmodifiableList(new ArrayList<>(tables));
        List<FilterGroup> groups = new ArrayList<>();
        for (FilterGroup group : filterGroups) {
            if (!group.isEmpty()) {
                groups.add(group);
            }
        }
        this.filterGroups = Collections.unmodifiableList(groups);
        this.distinct = distinct;
        this.orderBy = orderBy;
        this.limit = limit;
        validate();
    }

    public SQLQuery(Table table) {
        this(Collections.singletonList(table), Collections.emptyList(), false, null, null);
    }

    private void validate() {
        Set<String> names = new HashSet<>();
        for (Table table : tables) {
            if (!names.add(table.getName())) {
                throw new TranslationRejectedException("Joining table " + table.getName() + " to itself is not supported");
            }
        }
        for (int i = 1; i < tables.size(); i++) {
            TableJoin join = tables.get(i).getJoin();
            if (join == null) {
                throw new TranslationRejectedException(
                    "Table " + tables.get(i).getName() + " must be joined with JOIN ... ON");
            }
            if (!names.contains(join.getNeighborTable())) {
                throw new TranslationRejectedException("Unknown table in JOIN condition: " + join.getNeighborTable());
            }
        }

        Set<Integer> positions = new HashSet<>();
        for (Column column : getColumns()) {
            if (!positions.add(column.getPosition())) {
                throw new IllegalArgumentException("Duplicate column position " + column.getPosition());
            }
        }

        for (FilterGroup group : filterGroups) {
            for (Filter filter : group.getFilters()) {
                if (!names.contains(filter.getTableName())) {
                    throw new TranslationRejectedException("Unknown table in WHERE clause: " + filter.getTableName());
                }
            }
        }

        if (orderBy != null) {
            for (Column column : orderBy.getColumns()) {
                if (!getPrincipalTable().getName().equals(column.getTableName())) {
                    throw new TranslationRejectedException(
                        "ORDER BY columns must belong to the principal table " + getPrincipalTable().getName()
                            + ", got " + column);
                }
            }
        }
        if (limit != null && limit < 0) {
            throw new TranslationRejectedException("LIMIT must not be negative: " + limit);
        }
    }

    public List<Table> getTables() {
        return tables;
    }

    public Table getPrincipalTable() {
        return tables.get(0);
    }

    public boolean isJoined() {
        return tables.size() > 1;
    }

    public List<FilterGroup> getFilterGroups() {
        return filterGroups;
    }

    public boolean hasFilters() {
        return !filterGroups.isEmpty();
    }

    public boolean isDistinct() {
        return distinct;
    }

    public OrderBy getOrderBy() {
        return orderBy;
    }

    public Integer getLimit() {
        return limit;
    }

    /**
     * Columns of every table, in select-list order.
     */
    public List<Column> getColumns() {
        List<Column> columns = new ArrayList<>();
        for (Table table : tables) {
            columns.addAll(table.getColumns());
        }
        columns.sort(Comparator.comparingInt(Column::getPosition));
        return columns;
    }

    public List<String> getColumnAliases() {
        List<String> aliases = new ArrayList<>();
        for (Column column : getColumns()) {
            aliases.add(column.getAlias());
        }
        return aliases;
    }

    public boolean hasFunctions() {
        for (Column column : getColumns()) {
            if (column.getFunction() != null) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "SQLQuery{tables=" + tables + ", filterGroups=" + filterGroups + ", distinct=" + distinct
            + ", orderBy=" + orderBy + ", limit=" + limit + "}";
    }
}
