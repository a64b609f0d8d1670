package com.geico.poc.faunasql.translation;

import com.geico.poc.faunasql.config.FaunaSqlConfig;
import com.geico.poc.faunasql.sql.ParsedStatement;
import com.geico.poc.faunasql.sql.SqlStatementParser;
import com.geico.poc.faunasql.translation.ddl.DdlTranslator;
import com.geico.poc.faunasql.translation.dml.DmlTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Entry point of translation: one SQL statement in, the store calls that implement it out.
 * Nothing here talks to the store, so every rejection happens before a network call.
 */
@Component
public class SqlTranslator {

    private static final Logger log = LoggerFactory.getLogger(SqlTranslator.class);

    private final SqlStatementParser parser;
    private final DmlTranslator dml;
    private final DdlTranslator ddl;

    @Autowired
    public SqlTranslator(SqlStatementParser parser, FaunaSqlConfig config) {
        this(parser, config.getTranslation().getMaxPageSize());
    }

    public SqlTranslator(SqlStatementParser parser, int maxPageSize) {
        this.parser = parser;
        this.dml = new DmlTranslator(maxPageSize);
        this.ddl = new DdlTranslator(maxPageSize);
    }

    public CompiledStatement translate(String sql) {
        ParsedStatement statement = parser.parse(sql);
        log.debug("Parsed {}", statement);
        CompiledStatement compiled = statement.getType().isDdl()
            ? ddl.translate(statement)
            : dml.translate(statement);
        if (log.isDebugEnabled()) {
            for (int i = 0; i < compiled.getSteps().size(); i++) {
                log.debug("Step {}/{}: {}", i + 1, compiled.getSteps().size(), compiled.getSteps().get(i));
            }
        }
        return compiled;
    }
}
