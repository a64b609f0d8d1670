package com.geico.poc.faunasql.translation.dml;

import com.geico.poc.faunasql.fql.Expr;
import com.geico.poc.faunasql.fql.Fql;
import com.geico.poc.faunasql.schema.IndexKind;
import com.geico.poc.faunasql.schema.IndexNames;
import com.geico.poc.faunasql.sql.Column;
import com.geico.poc.faunasql.sql.Direction;
import com.geico.poc.faunasql.sql.Filter;
import com.geico.poc.faunasql.sql.FilterGroup;
import com.geico.poc.faunasql.sql.OrderBy;
import com.geico.poc.faunasql.sql.SQLQuery;
import com.geico.poc.faunasql.sql.SetOperation;
import com.geico.poc.faunasql.sql.Table;
import com.geico.poc.faunasql.sql.TableJoin;
import com.geico.poc.faunasql.translation.DocumentSets;
import com.geico.poc.faunasql.translation.JoinKeyCheck;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.geico.poc.faunasql.fql.Fql.arr;
import static com.geico.poc.faunasql.fql.Fql.get;
import static com.geico.poc.faunasql.fql.Fql.ifElse;
import static com.geico.poc.faunasql.fql.Fql.index;
import static com.geico.poc.faunasql.fql.Fql.isEmpty;
import static com.geico.poc.faunasql.fql.Fql.lambda;
import static com.geico.poc.faunasql.fql.Fql.map;
import static com.geico.poc.faunasql.fql.Fql.match;
import static com.geico.poc.faunasql.fql.Fql.merge;
import static com.geico.poc.faunasql.fql.Fql.not;
import static com.geico.poc.faunasql.fql.Fql.obj;
import static com.geico.poc.faunasql.fql.Fql.paginate;
import static com.geico.poc.faunasql.fql.Fql.path;
import static com.geico.poc.faunasql.fql.Fql.select;
import static com.geico.poc.faunasql.fql.Fql.singleton;
import static com.geico.poc.faunasql.fql.Fql.var;

/**
 * Builds the expression producing the rows a statement reads.
 *
 * A row is an object keyed by table name whose values are that table's document: its data
 * merged with its {@code ref}. Principal documents are read in the requested order; each
 * joined table contributes the documents linked to the row built so far, so an inner join
 * drops principal documents without partners.
 */
class RowPipeline {

    private final SQLQuery query;
    private final int pageSize;

    RowPipeline(SQLQuery query, int pageSize) {
        this.query = query;
        this.pageSize = pageSize;
    }

    /**
     * Refs of the principal table that satisfy the WHERE clause, in ORDER BY order.
     */
    Expr principalRefs() {
        String principal = principalName();
        Expr set;
        if (!query.hasFilters()) {
            set = DocumentSets.forFilters(principal, Collections.emptyList(), SetOperation.INTERSECTION);
        } else {
            List<Expr> sets = new ArrayList<>();
            for (FilterGroup group : query.getFilterGroups()) {
                sets.add(principalSet(group));
            }
            set = sets.size() == 1 ? sets.get(0) : Fql.union(sets);
        }
        return ordered(set);
    }

    Expr rows() {
        String principal = principalName();
        Expr refs = principalRefs();
        String refVar = refVar(principal);

        if (!query.isJoined()) {
            return map(lambda(refVar, obj(principal, document(principal))), refs);
        }

        Expr joinedRows;
        if (!constrainsJoinedTables()) {
            joinedRows = rowsFrom(1, null);
        } else {
            // each OR branch joins on its own; a row matched by several branches is kept once
            Expr concatenated = null;
            for (FilterGroup group : query.getFilterGroups()) {
                Expr branch = rowsFrom(1, group);
                if (!group.filtersFor(principal).isEmpty()) {
                    branch = ifElse(
                        not(isEmpty(Fql.intersection(singleton(var(refVar)), principalSet(group)))),
                        branch,
                        Fql.emptyArray());
                }
                concatenated = concatenated == null ? branch : Fql.append(branch, concatenated);
            }
            joinedRows = Fql.distinct(concatenated);
        }

        Expr withPrincipal = map(
            lambda("row", merge(var("row"), obj(principal, document(principal)))),
            joinedRows);
        return flatten(map(lambda(refVar, withPrincipal), refs));
    }

    /**
     * Foreign keys every JOIN condition relies on, one per joined table.
     */
    List<JoinKeyCheck> joinKeyChecks() {
        List<JoinKeyCheck> checks = new ArrayList<>();
        List<Table> tables = query.getTables();
        for (Table table : tables.subList(1, tables.size())) {
            checks.add(JoinKeyCheck.of(table.getName(), table.getJoin()));
        }
        return checks;
    }

    private boolean constrainsJoinedTables() {
        for (FilterGroup group : query.getFilterGroups()) {
            if (!group.constrainsOnly(principalName())) {
                return true;
            }
        }
        return false;
    }

    private Expr principalSet(FilterGroup group) {
        return DocumentSets.forFilters(principalName(), group.filtersFor(principalName()), group.getOperation());
    }

    private Expr rowsFrom(int position, FilterGroup group) {
        List<Table> tables = query.getTables();
        if (position == tables.size()) {
            return arr(obj());
        }
        Table table = tables.get(position);
        String name = table.getName();
        TableJoin join = table.getJoin();
        Expr neighborRef = var(refVar(join.getNeighborTable()));

        Expr linked;
        if (join.isJoinedById()) {
            linked = match(index(IndexNames.indexName(name, IndexKind.REF)),
                select(path("data", join.getNeighborKey().getName()), get(neighborRef), Fql.NULL));
        } else {
            linked = match(index(IndexNames.indexName(name, join.getOwnKey().getName(), IndexKind.REF)), neighborRef);
        }

        List<Filter> filters = group == null ? Collections.<Filter>emptyList() : group.filtersFor(name);
        Expr set = filters.isEmpty()
            ? linked
            : Fql.intersection(linked, DocumentSets.forFilters(name, filters, group.getOperation()));

        Expr refs = select(path("data"), paginate(set, pageSize));
        Expr rest = map(lambda("row", merge(var("row"), obj(name, document(name)))), rowsFrom(position + 1, group));
        return flatten(map(lambda(refVar(name), rest), refs));
    }

    private Expr ordered(Expr set) {
        OrderBy orderBy = query.getOrderBy();
        if (orderBy == null) {
            return select(path("data"), paginate(set, pageSize));
        }
        Column column = orderBy.getColumn();
        boolean descending = orderBy.getDirection() == Direction.DESC;
        if (column.isPrimaryKey()) {
            return select(path("data"), paginate(descending ? Fql.reverse(set) : set, pageSize));
        }
        Expr sorted = Fql.join(set, index(IndexNames.indexName(principalName(), column.getName(), IndexKind.SORT)));
        if (descending) {
            sorted = Fql.reverse(sorted);
        }
        return map(lambda(Arrays.asList("_", "ref"), var("ref")), select(path("data"), paginate(sorted, pageSize)));
    }

    private String principalName() {
        return query.getPrincipalTable().getName();
    }

    static String refVar(String table) {
        return "ref_" + table;
    }

    static Expr document(String table) {
        Expr ref = var(refVar(table));
        return merge(select(path("data"), get(ref)), obj("ref", ref));
    }

    /**
     * Concatenates an array of row arrays.
     */
    static Expr flatten(Expr arrays) {
        return Fql.reduce(
            lambda(Arrays.asList("acc", "rows"), Fql.append(var("rows"), var("acc"))),
            Fql.emptyArray(),
            arrays);
    }
}
