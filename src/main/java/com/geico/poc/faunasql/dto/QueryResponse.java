package com.geico.poc.faunasql.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.geico.poc.faunasql.client.QueryResult;

import java.util.Collections;
import java.util.List;

/**
 * HTTP body for one executed statement. Rows are positional: the n-th value of a row belongs
 * to the n-th entry of {@code columns}, so repeated output names keep all their values.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResponse {

    private final String statementType;
    private final List<String> columns;
    private final List<List<Object>> rows;
    private final String error;

    private QueryResponse(String statementType, List<String> columns, List<List<Object>> rows, String error) {
        this.statementType = statementType;
        this.columns = columns;
        this.rows = rows;
        this.error = error;
    }

    public static QueryResponse from(QueryResult result) {
        return new QueryResponse(result.getType().name(), result.getColumns(), result.getTuples(), null);
    }

    public static QueryResponse error(String message) {
        return new QueryResponse(null, Collections.emptyList(), Collections.emptyList(), message);
    }

    public String getStatementType() {
        return statementType;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    public String getError() {
        return error;
    }
}
