package com.geico.poc.faunasql.translation.ddl;

import com.geico.poc.faunasql.sql.ParsedStatement;
import com.geico.poc.faunasql.translation.CompiledStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates CREATE TABLE, CREATE INDEX, ALTER TABLE and DROP TABLE statements.
 */
public class DdlTranslator {

    private static final Logger log = LoggerFactory.getLogger(DdlTranslator.class);

    private final CreateTableTranslator createTable = new CreateTableTranslator();
    private final CreateIndexTranslator createIndex = new CreateIndexTranslator();
    private final AlterTableTranslator alterTable;
    private final DropTableTranslator dropTable;

    public DdlTranslator(int pageSize) {
        this.alterTable = new AlterTableTranslator(pageSize);
        this.dropTable = new DropTableTranslator(pageSize);
    }

    public CompiledStatement translate(ParsedStatement statement) {
        CompiledStatement compiled;
        switch (statement.getType()) {
            case CREATE_TABLE:
                compiled = createTable.translate(statement);
                break;
            case CREATE_INDEX:
                compiled = createIndex.translate(statement);
                break;
            case ALTER_TABLE:
                compiled = alterTable.translate(statement);
                break;
            case DROP_TABLE:
                compiled = dropTable.translate(statement);
                break;
            default:
                throw new IllegalArgumentException("Not a DDL statement: " + statement.getType());
        }
        log.debug("Translated {} into {} step(s)", statement.getType(), compiled.getSteps().size());
        return compiled;
    }
}
