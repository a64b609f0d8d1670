package com.geico.poc.faunasql.translation;

import com.geico.poc.faunasql.fql.Expr;
import com.geico.poc.faunasql.sql.ParsedStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of translating one SQL statement.
 *
 * Steps are sent to the store one after another; the last one evaluates to an array of rows,
 * each row an array of {@code [name, value]} pairs. Earlier steps exist only where the store
 * must finish provisioning before the next call, as with collections and their indexes.
 * Join key checks run before any step; a failed check means no step is sent.
 */
public class CompiledStatement {

    private final ParsedStatement.Type type;
    private final List<Expr> steps;
    private final List<String> columns;
    private final Integer limit;
    private final List<JoinKeyCheck> joinKeyChecks;

    public CompiledStatement(ParsedStatement.Type type, List<Expr> steps, List<String> columns, Integer limit) {
        this(type, steps, columns, limit, Collections.emptyList());
    }

    public CompiledStatement(ParsedStatement.Type type, List<Expr> steps, List<String> columns, Integer limit,
                             List<JoinKeyCheck> joinKeyChecks) {
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("A compiled statement needs at least one step");
        }
        this.type = type;
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
        this.columns = columns == null ? null : Collections.unmodifiableList(new ArrayList<>(columns));
        this.limit = limit;
        this.joinKeyChecks = Collections.unmodifiableList(new ArrayList<>(joinKeyChecks));
    }

    public static CompiledStatement single(ParsedStatement.Type type, Expr query, List<String> columns) {
        return new CompiledStatement(type, Collections.singletonList(query), columns, null);
    }

    public ParsedStatement.Type getType() {
        return type;
    }

    public List<Expr> getSteps() {
        return steps;
    }

    /**
     * Output column names known before execution, or null when the rows name them.
     */
    public List<String> getColumns() {
        return columns;
    }

    /**
     * Maximum number of rows to hand back, applied after the rows are decoded.
     */
    public Integer getLimit() {
        return limit;
    }

    public List<JoinKeyCheck> getJoinKeyChecks() {
        return joinKeyChecks;
    }

    @Override
    public String toString() {
        return type + " " + steps;
    }
}
