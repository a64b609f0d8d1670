package com.geico.poc.faunasql.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits SQL text on semicolons, ignoring semicolons inside quoted strings, quoted
 * identifiers and comments.
 */
public class StatementSplitter {

    public static List<String> split(String sql) {
        List<String> statements = new ArrayList<>();
        if (sql == null) {
            return statements;
        }

        StringBuilder current = new StringBuilder();
        boolean inString = false;
        char quote = 0;
        boolean inLineComment = false;
        boolean inBlockComment = false;

        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            char next = (i + 1 < sql.length()) ? sql.charAt(i + 1) : 0;

            if (inLineComment) {
                if (c == '\n') {
                    inLineComment = false;
                    current.append(c);
                }
                continue;
            }
            if (inBlockComment) {
                if (c == '*' && next == '/') {
                    inBlockComment = false;
                    i++;
                }
                continue;
            }

            if (inString) {
                current.append(c);
                if (c == quote) {
                    // doubled quote is an escaped quote
                    if (next == quote) {
                        current.append(next);
                        i++;
                    } else {
                        inString = false;
                    }
                }
                continue;
            }

            if (c == '-' && next == '-') {
                inLineComment = true;
                i++;
            } else if (c == '/' && next == '*') {
                inBlockComment = true;
                i++;
            } else if (c == '\'' || c == '"') {
                inString = true;
                quote = c;
                current.append(c);
            } else if (c == ';') {
                addStatement(statements, current);
                current = new StringBuilder();
            } else {
                current.append(c);
            }
        }
        addStatement(statements, current);
        return statements;
    }

    public static boolean hasMultipleStatements(String sql) {
        return split(sql).size() > 1;
    }

    private static void addStatement(List<String> statements, StringBuilder current) {
        String statement = current.toString().trim();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
    }
}
