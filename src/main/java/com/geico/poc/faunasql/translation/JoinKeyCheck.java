package com.geico.poc.faunasql.translation;

import com.geico.poc.faunasql.errors.TranslationRejectedException;
import com.geico.poc.faunasql.fql.Expr;
import com.geico.poc.faunasql.fql.Fql;
import com.geico.poc.faunasql.sql.TableJoin;

import java.util.ArrayList;
import java.util.List;

import static com.geico.poc.faunasql.fql.Fql.path;
import static com.geico.poc.faunasql.fql.Fql.select;
import static com.geico.poc.faunasql.fql.Fql.var;

/**
 * Requirement that a JOIN's non-id side is a foreign key declared on the referenced table.
 *
 * Only the stored schema knows which columns are foreign keys, so the requirement is read back
 * from the collection metadata before the statement's own query runs.
 */
public class JoinKeyCheck {

    private final String table;
    private final String column;
    private final String referencedTable;

    public JoinKeyCheck(String table, String column, String referencedTable) {
        this.table = table;
        this.column = column;
        this.referencedTable = referencedTable;
    }

    public static JoinKeyCheck of(String joinedTable, TableJoin join) {
        if (join.isJoinedById()) {
            return new JoinKeyCheck(join.getNeighborTable(), join.getNeighborKey().getName(), joinedTable);
        }
        return new JoinKeyCheck(joinedTable, join.getOwnKey().getName(), join.getNeighborTable());
    }

    public String getTable() {
        return table;
    }

    public String getColumn() {
        return column;
    }

    public String getReferencedTable() {
        return referencedTable;
    }

    /**
     * One query reading the referenced table of every checked column, null where a column
     * references nothing.
     */
    public static Expr lookup(List<JoinKeyCheck> checks) {
        List<Expr> targets = new ArrayList<>();
        for (JoinKeyCheck check : checks) {
            Expr references = SchemaQueries.referencesOf(check.column, SchemaQueries.fieldsOf(check.table));
            targets.add(Fql.let("references", references,
                Fql.ifElse(Fql.isNull(var("references")), Fql.NULL, select(path("table"), var("references")))));
        }
        return Fql.arr(targets);
    }

    /**
     * @param target the table the column references, as returned by {@link #lookup(List)}
     */
    public void verify(Object target) {
        if (target == null) {
            throw new TranslationRejectedException(
                "JOIN column " + table + "." + column + " is not a foreign key");
        }
        if (!referencedTable.equals(target)) {
            throw new TranslationRejectedException(
                "JOIN column " + table + "." + column + " references " + target + ", not " + referencedTable);
        }
    }

    @Override
    public String toString() {
        return table + "." + column + " -> " + referencedTable;
    }
}
