package com.geico.poc.faunasql.sql;

import com.geico.poc.faunasql.errors.TranslationRejectedException;
import org.apache.calcite.sql.JoinConditionType;
import org.apache.calcite.sql.JoinType;
import org.apache.calcite.sql.SqlBasicCall;
import org.apache.calcite.sql.SqlCall;
import org.apache.calcite.sql.SqlDelete;
import org.apache.calcite.sql.SqlIdentifier;
import org.apache.calcite.sql.SqlInsert;
import org.apache.calcite.sql.SqlJoin;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlNodeList;
import org.apache.calcite.sql.SqlNumericLiteral;
import org.apache.calcite.sql.SqlOrderBy;
import org.apache.calcite.sql.SqlSelect;
import org.apache.calcite.sql.SqlUpdate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link SQLQuery} from a Calcite parse tree. Everything the translator cannot
 * support is rejected here, before any store call.
 */
public final class SqlQueryBuilder {

    private SqlQueryBuilder() {
    }

    // ---- SELECT --------------------------------------------------------------------------

    public static SQLQuery fromSelect(SqlNode node) {
        SqlNodeList orderList = null;
        SqlNode fetch = null;
        SqlNode offset = null;

        if (node instanceof SqlOrderBy) {
            SqlOrderBy orderBy = (SqlOrderBy) node;
            orderList = orderBy.orderList;
            fetch = orderBy.fetch;
            offset = orderBy.offset;
            node = orderBy.query;
        }
        if (!(node instanceof SqlSelect)) {
            throw new TranslationRejectedException("Only single SELECT statements are supported, got " + node.getKind());
        }

        SqlSelect select = (SqlSelect) node;
        if (orderList == null) {
            orderList = select.getOrderList();
        }
        if (fetch == null) {
            fetch = select.getFetch();
        }
        if (offset == null) {
            offset = select.getOffset();
        }
        if (offset != null) {
            throw new TranslationRejectedException("OFFSET is not supported");
        }
        if (select.getGroup() != null || select.getHaving() != null) {
            throw new TranslationRejectedException("GROUP BY and HAVING are not supported");
        }
        if (select.getFrom() == null) {
            throw new TranslationRejectedException("SELECT without FROM is not supported");
        }

        List<TableReference> references = new ArrayList<>();
        collectFrom(select.getFrom(), null, references);
        Scope scope = new Scope(references);

        Map<String, List<Column>> columnsByTable = new LinkedHashMap<>();
        for (TableReference reference : references) {
            columnsByTable.put(reference.name, new ArrayList<>());
        }
        int position = 0;
        for (SqlNode item : select.getSelectList()) {
            Column column = selectedColumn(item, position++, scope);
            columnsByTable.get(column.getTableName()).add(column);
        }

        List<Table> tables = new ArrayList<>();
        for (TableReference reference : references) {
            TableJoin join = reference.condition == null ? null : joinFor(reference, scope);
            tables.add(new Table(reference.name, reference.alias, columnsByTable.get(reference.name), join));
        }

        return new SQLQuery(
            tables,
            filterGroups(select.getWhere(), scope),
            select.isDistinct(),
            orderBy(orderList, scope),
            limit(fetch));
    }

    private static void collectFrom(SqlNode from, SqlNode condition, List<TableReference> references) {
        if (from instanceof SqlJoin) {
            SqlJoin join = (SqlJoin) from;
            if (join.getJoinType() == JoinType.COMMA) {
                throw new TranslationRejectedException(
                    "Selecting from multiple tables separated by commas is not supported; use JOIN ... ON");
            }
            if (join.getJoinType() != JoinType.INNER || join.isNatural()) {
                throw new TranslationRejectedException("Only INNER JOIN is supported, got " + join.getJoinType());
            }
            if (join.getConditionType() != JoinConditionType.ON) {
                throw new TranslationRejectedException("JOIN requires an ON condition");
            }
            if (join.getRight() instanceof SqlJoin) {
                throw new TranslationRejectedException("Parenthesized JOINs are not supported");
            }
            collectFrom(join.getLeft(), null, references);
            collectFrom(join.getRight(), join.getCondition(), references);
            return;
        }
        TableReference reference = tableReference(from);
        references.add(new TableReference(reference.name, reference.alias, condition));
    }

    private static TableJoin joinFor(TableReference reference, Scope scope) {
        SqlNode condition = reference.condition;
        if (condition.getKind() != SqlKind.EQUALS) {
            throw new TranslationRejectedException("JOIN conditions must be a single equality, got: " + condition);
        }
        SqlBasicCall equality = (SqlBasicCall) condition;
        if (!(equality.operand(0) instanceof SqlIdentifier) || !(equality.operand(1) instanceof SqlIdentifier)) {
            throw new TranslationRejectedException("JOIN conditions must compare two columns, got: " + condition);
        }
        Column left = scope.resolve((SqlIdentifier) equality.operand(0));
        Column right = scope.resolve((SqlIdentifier) equality.operand(1));

        if (left.getTableName().equals(reference.name) && scope.isBefore(right.getTableName(), reference.name)) {
            return new TableJoin(left, right);
        }
        if (right.getTableName().equals(reference.name) && scope.isBefore(left.getTableName(), reference.name)) {
            return new TableJoin(right, left);
        }
        throw new TranslationRejectedException(
            "JOIN condition must link " + reference.name + " to a table joined before it: " + condition);
    }

    private static Column selectedColumn(SqlNode item, int position, Scope scope) {
        SqlNode expression = item;
        String alias = null;
        if (item.getKind() == SqlKind.AS) {
            SqlBasicCall as = (SqlBasicCall) item;
            expression = as.operand(0);
            alias = ((SqlIdentifier) as.operand(1)).getSimple();
        }

        SqlFunction function = null;
        if (expression instanceof SqlBasicCall && !(SqlValues.isLiteral(expression))) {
            SqlBasicCall call = (SqlBasicCall) expression;
            function = SqlFunction.fromName(call.getOperator().getName());
            if (call.getFunctionQuantifier() != null) {
                throw new TranslationRejectedException("DISTINCT inside functions is not supported");
            }
            if (call.operandCount() != 1) {
                throw new TranslationRejectedException("Functions must wrap exactly one column: " + call);
            }
            expression = call.operand(0);
        }

        if (!(expression instanceof SqlIdentifier)) {
            throw new TranslationRejectedException("Only columns and COUNT(column) can be selected, got: " + expression);
        }
        SqlIdentifier identifier = (SqlIdentifier) expression;
        if (identifier.isStar()) {
            if (function != SqlFunction.COUNT) {
                throw new TranslationRejectedException("Wildcard SELECT is not supported; list the columns explicitly");
            }
            return Column.selected(scope.principal(), Column.ID, alias, position, function);
        }
        Column column = scope.resolve(identifier);
        return Column.selected(column.getTableName(), column.getSqlName(), alias, position, function);
    }

    private static OrderBy orderBy(SqlNodeList orderList, Scope scope) {
        if (orderList == null || orderList.size() == 0) {
            return null;
        }
        List<Column> columns = new ArrayList<>();
        Direction direction = null;
        for (SqlNode item : orderList) {
            Direction itemDirection = Direction.ASC;
            SqlNode expression = item;
            if (item.getKind() == SqlKind.DESCENDING) {
                itemDirection = Direction.DESC;
                expression = ((SqlCall) item).operand(0);
            }
            if (expression.getKind() == SqlKind.NULLS_FIRST || expression.getKind() == SqlKind.NULLS_LAST) {
                throw new TranslationRejectedException("NULLS FIRST/LAST is not supported");
            }
            if (!(expression instanceof SqlIdentifier)) {
                throw new TranslationRejectedException("ORDER BY supports columns only, got: " + expression);
            }
            if (direction != null && direction != itemDirection) {
                throw new TranslationRejectedException("ORDER BY columns must share one direction");
            }
            direction = itemDirection;
            columns.add(scope.resolve((SqlIdentifier) expression));
        }
        return new OrderBy(columns, direction);
    }

    private static Integer limit(SqlNode fetch) {
        if (fetch == null) {
            return null;
        }
        if (!(fetch instanceof SqlNumericLiteral)) {
            throw new TranslationRejectedException("LIMIT must be a number, got: " + fetch);
        }
        BigDecimal value = ((SqlNumericLiteral) fetch).getValueAs(BigDecimal.class);
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new TranslationRejectedException("LIMIT must be a whole number up to " + Integer.MAX_VALUE
                + ", got: " + value, e);
        }
    }

    // ---- INSERT / UPDATE / DELETE --------------------------------------------------------

    public static SQLQuery fromInsert(SqlInsert insert) {
        TableReference target = tableReference(insert.getTargetTable());
        SqlNodeList targetColumns = insert.getTargetColumnList();
        if (targetColumns == null || targetColumns.size() == 0) {
            throw new TranslationRejectedException("INSERT requires an explicit column list");
        }

        SqlNode source = insert.getSource();
        if (source.getKind() != SqlKind.VALUES) {
            throw new TranslationRejectedException("Only INSERT ... VALUES is supported");
        }
        List<SqlNode> rows = ((SqlBasicCall) source).getOperandList();
        if (rows.size() != 1) {
            throw new TranslationRejectedException("INSERT supports exactly one VALUES row, got " + rows.size());
        }
        List<SqlNode> values = ((SqlCall) rows.get(0)).getOperandList();
        if (values.size() != targetColumns.size()) {
            throw new TranslationRejectedException(
                "INSERT has " + targetColumns.size() + " columns but " + values.size() + " values");
        }

        return new SQLQuery(new Table(target.name, target.alias, assignments(target.name, targetColumns, values), null));
    }

    public static SQLQuery fromUpdate(SqlUpdate update) {
        TableReference target = tableReference(update.getTargetTable());
        String alias = update.getAlias() != null ? update.getAlias().getSimple() : target.alias;
        TableReference reference = new TableReference(target.name, alias, null);

        List<Column> columns = assignments(target.name, update.getTargetColumnList(), update.getSourceExpressionList());
        Table table = new Table(target.name, alias, columns, null);
        Scope scope = new Scope(Collections.singletonList(reference));
        return new SQLQuery(
            Collections.singletonList(table), filterGroups(update.getCondition(), scope), false, null, null);
    }

    public static SQLQuery fromDelete(SqlDelete delete) {
        TableReference target = tableReference(delete.getTargetTable());
        String alias = delete.getAlias() != null ? delete.getAlias().getSimple() : target.alias;
        TableReference reference = new TableReference(target.name, alias, null);

        Scope scope = new Scope(Collections.singletonList(reference));
        return new SQLQuery(
            Collections.singletonList(new Table(target.name, alias, Collections.emptyList(), null)),
            filterGroups(delete.getCondition(), scope), false, null, null);
    }

    private static List<Column> assignments(String table, List<SqlNode> names, List<SqlNode> values) {
        List<Column> columns = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            SqlIdentifier name = (SqlIdentifier) names.get(i);
            String columnName = name.names.get(name.names.size() - 1);
            if (Column.ID.equals(columnName)) {
                throw new TranslationRejectedException("The id column is assigned by the store and cannot be written");
            }
            if (!SqlValues.isLiteral(values.get(i))) {
                throw new TranslationRejectedException(
                    "Only literal values can be assigned to " + columnName + ", got: " + values.get(i));
            }
            columns.add(Column.assigned(table, columnName, i, SqlValues.extract(values.get(i))));
        }
        return columns;
    }

    // ---- WHERE ---------------------------------------------------------------------------

    static List<FilterGroup> filterGroups(SqlNode where, Scope scope) {
        if (where == null) {
            return Collections.emptyList();
        }
        List<SqlNode> branches = new ArrayList<>();
        flatten(where, SqlKind.OR, branches);

        List<FilterGroup> groups = new ArrayList<>();
        for (SqlNode branch : branches) {
            List<SqlNode> conditions = new ArrayList<>();
            flatten(branch, SqlKind.AND, conditions);
            List<Filter> filters = new ArrayList<>();
            for (SqlNode condition : conditions) {
                filters.add(filter(condition, scope));
            }
            groups.add(FilterGroup.intersection(filters));
        }
        return groups;
    }

    private static void flatten(SqlNode node, SqlKind kind, List<SqlNode> out) {
        if (node.getKind() == kind) {
            for (SqlNode operand : ((SqlCall) node).getOperandList()) {
                flatten(operand, kind, out);
            }
        } else {
            out.add(node);
        }
    }

    private static Filter filter(SqlNode condition, Scope scope) {
        switch (condition.getKind()) {
            case OR:
            case AND:
                throw new TranslationRejectedException("Nested conditions in parentheses are not supported: " + condition);
            case IS_NULL: {
                SqlNode operand = ((SqlCall) condition).operand(0);
                if (!(operand instanceof SqlIdentifier)) {
                    throw new TranslationRejectedException("IS NULL must test a column, got: " + operand);
                }
                return Filter.isNull(scope.resolve((SqlIdentifier) operand));
            }
            case EQUALS:
                return comparison((SqlCall) condition, Comparison.EQUAL, scope);
            case GREATER_THAN:
                return comparison((SqlCall) condition, Comparison.GREATER_THAN, scope);
            case GREATER_THAN_OR_EQUAL:
                return comparison((SqlCall) condition, Comparison.GREATER_THAN_OR_EQUAL, scope);
            case LESS_THAN:
                return comparison((SqlCall) condition, Comparison.LESS_THAN, scope);
            case LESS_THAN_OR_EQUAL:
                return comparison((SqlCall) condition, Comparison.LESS_THAN_OR_EQUAL, scope);
            case LIKE:
            case IN:
            case NOT_IN:
            case BETWEEN:
            case NOT_EQUALS:
            case IS_NOT_NULL:
            case NOT:
                throw new TranslationRejectedException(
                    "Unsupported WHERE operator " + ((SqlCall) condition).getOperator().getName() + ": " + condition);
            default:
                throw new TranslationRejectedException("Unsupported WHERE condition: " + condition);
        }
    }

    private static Filter comparison(SqlCall call, Comparison comparison, Scope scope) {
        SqlNode left = call.operand(0);
        SqlNode right = call.operand(1);

        if (left instanceof SqlIdentifier && SqlValues.isLiteral(right)) {
            return new Filter(scope.resolve((SqlIdentifier) left), comparison, SqlValues.extract(right));
        }
        if (SqlValues.isLiteral(left) && right instanceof SqlIdentifier) {
            return Filter.valueFirst(SqlValues.extract(left), comparison, scope.resolve((SqlIdentifier) right));
        }
        if (left instanceof SqlIdentifier && right instanceof SqlIdentifier) {
            throw new TranslationRejectedException("Comparing two columns is only supported in JOIN ... ON: " + call);
        }
        throw new TranslationRejectedException("Comparisons must be between a column and a literal value: " + call);
    }

    // ---- tables --------------------------------------------------------------------------

    private static TableReference tableReference(SqlNode node) {
        if (node instanceof SqlIdentifier) {
            return new TableReference(tableName((SqlIdentifier) node), null, null);
        }
        if (node.getKind() == SqlKind.AS) {
            SqlBasicCall as = (SqlBasicCall) node;
            if (as.operand(0) instanceof SqlIdentifier) {
                return new TableReference(
                    tableName((SqlIdentifier) as.operand(0)), ((SqlIdentifier) as.operand(1)).getSimple(), null);
            }
        }
        throw new TranslationRejectedException("Only plain table names are supported in FROM, got: " + node);
    }

    private static String tableName(SqlIdentifier identifier) {
        if (!identifier.isSimple()) {
            throw new TranslationRejectedException("Schema-qualified table names are not supported: " + identifier);
        }
        return identifier.getSimple();
    }

    private static final class TableReference {
        private final String name;
        private final String alias;
        private final SqlNode condition;

        private TableReference(String name, String alias, SqlNode condition) {
            this.name = name;
            this.alias = alias;
            this.condition = condition;
        }
    }

    /**
     * Resolves column identifiers against the tables of the statement, in FROM order.
     */
    static final class Scope {
        private final List<TableReference> tables;

        private Scope(List<TableReference> tables) {
            this.tables = tables;
        }

        String principal() {
            return tables.get(0).name;
        }

        boolean isBefore(String table, String other) {
            int tableIndex = -1;
            int otherIndex = -1;
            for (int i = 0; i < tables.size(); i++) {
                if (tables.get(i).name.equals(table)) {
                    tableIndex = i;
                }
                if (tables.get(i).name.equals(other)) {
                    otherIndex = i;
                }
            }
            return tableIndex >= 0 && tableIndex < otherIndex;
        }

        Column resolve(SqlIdentifier identifier) {
            List<String> names = identifier.names;
            if (names.size() == 1) {
                return Column.named(principal(), names.get(0));
            }
            if (names.size() == 2) {
                for (TableReference table : tables) {
                    if (table.name.equals(names.get(0)) || names.get(0).equals(table.alias)) {
                        return Column.named(table.name, names.get(1));
                    }
                }
                throw new TranslationRejectedException("Unknown table or alias " + names.get(0) + " in " + identifier);
            }
            throw new TranslationRejectedException("Unsupported column reference: " + identifier);
        }
    }
}
