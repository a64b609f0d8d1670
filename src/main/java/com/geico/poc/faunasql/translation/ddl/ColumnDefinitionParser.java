package com.geico.poc.faunasql.translation.ddl;

import com.geico.poc.faunasql.errors.TranslationRejectedException;
import com.geico.poc.faunasql.schema.DataTypes;
import com.geico.poc.faunasql.schema.FieldMetadata;
import com.geico.poc.faunasql.schema.ForeignKeyReference;
import com.geico.poc.faunasql.sql.Column;
import com.geico.poc.faunasql.sql.SqlValues;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the text of a CREATE TABLE statement into field metadata.
 *
 * Supports:
 * 1. Column options: {@code name VARCHAR(50) NOT NULL UNIQUE DEFAULT 'x' REFERENCES t(id)}
 * 2. Table constraints: {@code PRIMARY KEY (col)}, {@code UNIQUE (col)},
 *    {@code FOREIGN KEY (col) REFERENCES t (id)}, each optionally named with CONSTRAINT
 */
public final class ColumnDefinitionParser {

    private static final Pattern CREATE_TABLE = Pattern.compile(
        "(?is)^CREATE\\s+TABLE\\s+(IF\\s+NOT\\s+EXISTS\\s+)?\"?(\\w+)\"?\\s*\\((.*)\\)\\s*$");
    private static final Pattern TABLE_CONSTRAINT = Pattern.compile(
        "(?is)^(?:CONSTRAINT|PRIMARY\\s+KEY|UNIQUE|FOREIGN\\s+KEY|CHECK|INDEX|KEY)\\b");
    private static final Pattern CONSTRAINT_NAME = Pattern.compile("(?is)^CONSTRAINT\\s+\"?\\w+\"?\\s+(.*)$");
    private static final Pattern PRIMARY_KEY_CONSTRAINT = Pattern.compile("(?is)^PRIMARY\\s+KEY\\s*\\(([^)]*)\\)\\s*$");
    private static final Pattern UNIQUE_CONSTRAINT = Pattern.compile("(?is)^UNIQUE(?:\\s+KEY)?\\s*\\(([^)]*)\\)\\s*$");
    private static final Pattern FOREIGN_KEY_CONSTRAINT = Pattern.compile(
        "(?is)^FOREIGN\\s+KEY\\s*\\(([^)]*)\\)\\s*(REFERENCES\\s+.*)$");
    private static final Pattern COLUMN = Pattern.compile(
        "(?is)^(\"?\\w+\"?)\\s+([A-Za-z]+(?:\\s+(?:PRECISION|VARYING))?(?:\\s*\\([^)]*\\))?)(.*)$");

    private static final Pattern NOT_NULL = Pattern.compile("(?i)\\bNOT\\s+NULL\\b");
    private static final Pattern UNIQUE = Pattern.compile("(?i)\\bUNIQUE\\b");
    private static final Pattern PRIMARY_KEY = Pattern.compile("(?i)\\bPRIMARY\\s+KEY\\b");
    private static final Pattern CHECK = Pattern.compile("(?i)\\bCHECK\\b");
    private static final Pattern DEFAULT = Pattern.compile("(?i)\\bDEFAULT\\s+('(?:[^']|'')*'|[^\\s,]+)");
    private static final Pattern REFERENCES = Pattern.compile(
        "(?i)\\bREFERENCES\\s+\"?(\\w+)\"?\\s*(?:\\(\\s*\"?(\\w+)\"?\\s*\\))?");
    private static final Pattern QUOTED = Pattern.compile("'(?:[^']|'')*'");

    private ColumnDefinitionParser() {
    }

    public static TableDefinition parse(String sql) {
        Matcher matcher = CREATE_TABLE.matcher(sql.trim());
        if (!matcher.matches()) {
            throw new TranslationRejectedException("Invalid CREATE TABLE syntax: " + sql);
        }
        String tableName = matcher.group(2);
        boolean ifNotExists = matcher.group(1) != null;

        Map<String, FieldMetadata> fields = new LinkedHashMap<>();
        List<String> definitions = smartSplit(matcher.group(3));
        // columns first so table constraints can refer to columns declared after them
        List<String> constraints = new ArrayList<>();
        for (String definition : definitions) {
            if (definition.isEmpty()) {
                continue;
            }
            if (isTableConstraint(definition)) {
                constraints.add(definition);
            } else {
                defineColumn(fields, definition);
            }
        }
        for (String constraint : constraints) {
            applyConstraint(fields, constraint);
        }
        if (fields.isEmpty()) {
            throw new TranslationRejectedException("CREATE TABLE " + tableName + " declares no columns besides id");
        }
        return new TableDefinition(tableName, ifNotExists, new ArrayList<>(fields.values()));
    }

    private static boolean isTableConstraint(String definition) {
        return TABLE_CONSTRAINT.matcher(definition).lookingAt();
    }

    private static void defineColumn(Map<String, FieldMetadata> fields, String definition) {
        Matcher matcher = COLUMN.matcher(definition);
        if (!matcher.matches()) {
            throw new TranslationRejectedException("Invalid column definition: " + definition);
        }
        String name = unquote(matcher.group(1));
        String options = matcher.group(3);
        String keywords = QUOTED.matcher(options).replaceAll("''");

        if (CHECK.matcher(keywords).find()) {
            throw new TranslationRejectedException("CHECK constraints are not supported: " + definition);
        }
        // id is the document ref, managed by the store
        if (Column.ID.equals(name)) {
            return;
        }
        if (fields.containsKey(name)) {
            throw new TranslationRejectedException("Column " + name + " is declared twice");
        }

        boolean primaryKey = PRIMARY_KEY.matcher(keywords).find();
        boolean unique = primaryKey || UNIQUE.matcher(keywords).find();
        boolean notNull = primaryKey || NOT_NULL.matcher(keywords).find();

        ForeignKeyReference references = null;
        Matcher referencesMatcher = REFERENCES.matcher(keywords);
        if (referencesMatcher.find()) {
            references = reference(referencesMatcher.group(1), referencesMatcher.group(2), definition);
        }

        Object defaultValue = null;
        Matcher defaultMatcher = DEFAULT.matcher(options);
        if (defaultMatcher.find()) {
            defaultValue = SqlValues.extract(defaultMatcher.group(1));
            if (references != null && defaultValue != null) {
                defaultValue = String.valueOf(defaultValue);
            }
        }

        fields.put(name, new FieldMetadata(name, DataTypes.fromSql(matcher.group(2)), unique, notNull,
            defaultValue, references));
    }

    private static void applyConstraint(Map<String, FieldMetadata> fields, String definition) {
        String constraint = definition;
        Matcher named = CONSTRAINT_NAME.matcher(constraint);
        if (named.matches()) {
            constraint = named.group(1).trim();
        }

        Matcher primaryKey = PRIMARY_KEY_CONSTRAINT.matcher(constraint);
        if (primaryKey.matches()) {
            List<String> columns = columnList(primaryKey.group(1));
            columns.remove(Column.ID);
            if (columns.size() > 1) {
                throw new TranslationRejectedException("Composite primary keys are not supported: " + definition);
            }
            for (String column : columns) {
                FieldMetadata field = existingField(fields, column, definition);
                fields.put(column, field.withUnique(true).withNotNull(true));
            }
            return;
        }

        Matcher unique = UNIQUE_CONSTRAINT.matcher(constraint);
        if (unique.matches()) {
            List<String> columns = columnList(unique.group(1));
            if (columns.size() != 1) {
                throw new TranslationRejectedException("Multi-column UNIQUE constraints are not supported: " + definition);
            }
            String column = columns.get(0);
            if (!Column.ID.equals(column)) {
                fields.put(column, existingField(fields, column, definition).withUnique(true));
            }
            return;
        }

        Matcher foreignKey = FOREIGN_KEY_CONSTRAINT.matcher(constraint);
        if (foreignKey.matches()) {
            List<String> columns = columnList(foreignKey.group(1));
            if (columns.size() != 1) {
                throw new TranslationRejectedException("Multi-column foreign keys are not supported: " + definition);
            }
            Matcher references = REFERENCES.matcher(foreignKey.group(2));
            if (!references.find()) {
                throw new TranslationRejectedException("Invalid FOREIGN KEY constraint: " + definition);
            }
            String column = columns.get(0);
            FieldMetadata field = existingField(fields, column, definition);
            if (field.isForeignKey()) {
                throw new TranslationRejectedException(
                    "Foreign keys with multiple references are not supported: " + column);
            }
            fields.put(column, field.withReferences(reference(references.group(1), references.group(2), definition)));
            return;
        }

        if (CHECK.matcher(constraint).lookingAt()) {
            throw new TranslationRejectedException("CHECK constraints are not supported: " + definition);
        }
        throw new TranslationRejectedException("Unsupported table constraint: " + definition);
    }

    private static ForeignKeyReference reference(String table, String column, String definition) {
        String referredColumn = column == null ? Column.ID : column;
        if (!Column.ID.equals(referredColumn)) {
            throw new TranslationRejectedException(
                "Foreign keys can only reference id columns, got " + table + "." + referredColumn + " in: " + definition);
        }
        return new ForeignKeyReference(table, Column.ID);
    }

    private static FieldMetadata existingField(Map<String, FieldMetadata> fields, String column, String definition) {
        FieldMetadata field = fields.get(column);
        if (field == null) {
            throw new TranslationRejectedException("Constraint refers to unknown column " + column + ": " + definition);
        }
        return field;
    }

    private static List<String> columnList(String list) {
        List<String> columns = new ArrayList<>();
        for (String column : list.split(",")) {
            String name = unquote(column.trim());
            if (!name.isEmpty()) {
                columns.add(name);
            }
        }
        return columns;
    }

    private static String unquote(String identifier) {
        if (identifier.length() >= 2 && identifier.startsWith("\"") && identifier.endsWith("\"")) {
            return identifier.substring(1, identifier.length() - 1);
        }
        return identifier;
    }

    /**
     * Splits on commas outside parentheses and quoted strings.
     *
     * Example: "id INT, name TEXT, PRIMARY KEY (id, name)"
     *   -> ["id INT", "name TEXT", "PRIMARY KEY (id, name)"]
     */
    static List<String> smartSplit(String input) {
        List<String> result = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int parenDepth = 0;
        boolean inQuote = false;

        for (char c : input.toCharArray()) {
            if (c == '\'') {
                inQuote = !inQuote;
                current.append(c);
            } else if (inQuote) {
                current.append(c);
            } else if (c == '(') {
                parenDepth++;
                current.append(c);
            } else if (c == ')') {
                parenDepth--;
                current.append(c);
            } else if (c == ',' && parenDepth == 0) {
                result.add(current.toString().trim());
                current = new StringBuilder();
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            result.add(current.toString().trim());
        }
        return result;
    }
}
