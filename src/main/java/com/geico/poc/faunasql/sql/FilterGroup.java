package com.geico.poc.faunasql.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Filters combined by one set operation. A WHERE clause becomes one INTERSECTION group per
 * top-level OR branch.
 */
public class FilterGroup {

    private final SetOperation operation;
    private final List<Filter> filters;

    public FilterGroup(SetOperation operation, List<Filter> filters) {
        this.operation = operation;
        this.filters = Collections.unmodifiableList(new ArrayList<>(filters));
    }

    public static FilterGroup intersection(List<Filter> filters) {
        return new FilterGroup(SetOperation.INTERSECTION, filters);
    }

    public SetOperation getOperation() {
        return operation;
    }

    public List<Filter> getFilters() {
        return filters;
    }

    public List<Filter> filtersFor(String tableName) {
        List<Filter> result = new ArrayList<>();
        for (Filter filter : filters) {
            if (filter.getTableName().equals(tableName)) {
                result.add(filter);
            }
        }
        return result;
    }

    public boolean constrainsOnly(String tableName) {
        for (Filter filter : filters) {
            if (!filter.getTableName().equals(tableName)) {
                return false;
            }
        }
        return true;
    }

    public boolean isEmpty() {
        return filters.isEmpty();
    }

    @Override
    public String toString() {
        return operation + " " + filters;
    }
}
