package com.geico.poc.faunasql.translation.dml;

import com.geico.poc.faunasql.sql.ParsedStatement;
import com.geico.poc.faunasql.sql.SQLQuery;
import com.geico.poc.faunasql.sql.SqlQueryBuilder;
import com.geico.poc.faunasql.translation.CompiledStatement;
import org.apache.calcite.sql.SqlDelete;
import org.apache.calcite.sql.SqlInsert;
import org.apache.calcite.sql.SqlUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates SELECT, INSERT, UPDATE and DELETE statements.
 */
public class DmlTranslator {

    private static final Logger log = LoggerFactory.getLogger(DmlTranslator.class);

    private final SelectTranslator selects;
    private final InsertTranslator inserts;
    private final UpdateTranslator updates;
    private final DeleteTranslator deletes;

    /**
     * @param pageSize maximum number of documents read from any one set
     */
    public DmlTranslator(int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive, got " + pageSize);
        }
        this.selects = new SelectTranslator(pageSize);
        this.inserts = new InsertTranslator();
        this.updates = new UpdateTranslator(pageSize);
        this.deletes = new DeleteTranslator(pageSize);
    }

    public CompiledStatement translate(ParsedStatement statement) {
        SQLQuery query;
        CompiledStatement compiled;
        switch (statement.getType()) {
            case SELECT:
                query = SqlQueryBuilder.fromSelect(statement.getNode());
                compiled = selects.translate(query);
                break;
            case INSERT:
                query = SqlQueryBuilder.fromInsert((SqlInsert) statement.getNode());
                compiled = inserts.translate(query);
                break;
            case UPDATE:
                query = SqlQueryBuilder.fromUpdate((SqlUpdate) statement.getNode());
                compiled = updates.translate(query);
                break;
            case DELETE:
                query = SqlQueryBuilder.fromDelete((SqlDelete) statement.getNode());
                compiled = deletes.translate(query);
                break;
            default:
                throw new IllegalArgumentException("Not a DML statement: " + statement.getType());
        }
        log.debug("Translated {} into {}", query, compiled);
        return compiled;
    }
}
