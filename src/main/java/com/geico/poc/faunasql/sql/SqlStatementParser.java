package com.geico.poc.faunasql.sql;

import com.geico.poc.faunasql.errors.TranslationRejectedException;
import org.apache.calcite.avatica.util.Casing;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlNodeList;
import org.apache.calcite.sql.parser.SqlParseException;
import org.apache.calcite.sql.parser.SqlParser;
import org.apache.calcite.sql.parser.ddl.SqlDdlParserImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Classifies a SQL statement and parses it with Calcite where Calcite's grammar covers it.
 *
 * CREATE TABLE, CREATE INDEX and ALTER TABLE carry column options (DEFAULT, REFERENCES,
 * FOREIGN KEY) that the DDL translators read from the statement text.
 */
@Component
public class SqlStatementParser {

    private static final Logger log = LoggerFactory.getLogger(SqlStatementParser.class);

    private static final SqlParser.Config PARSER_CONFIG = SqlParser.config()
        .withParserFactory(SqlDdlParserImpl.FACTORY)
        .withUnquotedCasing(Casing.UNCHANGED)
        .withQuotedCasing(Casing.UNCHANGED)
        .withCaseSensitive(true);

    public ParsedStatement parse(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            throw new TranslationRejectedException("Empty SQL statement");
        }
        List<String> statements = StatementSplitter.split(sql);
        if (statements.size() != 1) {
            throw new TranslationRejectedException(
                "Exactly one SQL statement is supported per call, got " + statements.size());
        }
        String statement = statements.get(0);
        String upper = statement.toUpperCase().replaceAll("\\s+", " ");

        if (upper.startsWith("CREATE TABLE")) {
            return new ParsedStatement(ParsedStatement.Type.CREATE_TABLE, statement, null);
        }
        if (upper.startsWith("CREATE INDEX") || upper.startsWith("CREATE UNIQUE INDEX")) {
            return new ParsedStatement(ParsedStatement.Type.CREATE_INDEX, statement, null);
        }
        if (upper.startsWith("ALTER TABLE")) {
            return new ParsedStatement(ParsedStatement.Type.ALTER_TABLE, statement, null);
        }
        if (upper.startsWith("DROP TABLE")) {
            return new ParsedStatement(ParsedStatement.Type.DROP_TABLE, statement, parseWithCalcite(statement));
        }
        if (upper.startsWith("SELECT")) {
            return new ParsedStatement(ParsedStatement.Type.SELECT, statement, parseWithCalcite(statement));
        }
        if (upper.startsWith("INSERT")) {
            return new ParsedStatement(ParsedStatement.Type.INSERT, statement, parseWithCalcite(statement));
        }
        if (upper.startsWith("UPDATE")) {
            return new ParsedStatement(ParsedStatement.Type.UPDATE, statement, parseWithCalcite(statement));
        }
        if (upper.startsWith("DELETE")) {
            return new ParsedStatement(ParsedStatement.Type.DELETE, statement, parseWithCalcite(statement));
        }
        if (upper.startsWith("WITH")) {
            throw new TranslationRejectedException("Common table expressions are not supported");
        }
        throw new TranslationRejectedException("Unsupported SQL statement: " + abbreviate(statement));
    }

    private SqlNode parseWithCalcite(String sql) {
        try {
            SqlNodeList nodes = SqlParser.create(sql, PARSER_CONFIG).parseStmtList();
            if (nodes.size() != 1) {
                throw new TranslationRejectedException("Exactly one SQL statement is supported per call");
            }
            return nodes.get(0);
        } catch (SqlParseException e) {
            log.debug("Calcite could not parse {}: {}", abbreviate(sql), e.getMessage());
            throw new TranslationRejectedException("Could not parse SQL: " + e.getMessage(), e);
        }
    }

    private static String abbreviate(String sql) {
        return sql.length() > 100 ? sql.substring(0, 100) + "..." : sql;
    }
}
