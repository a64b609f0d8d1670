package com.geico.poc.faunasql.dbapi;

import com.geico.poc.faunasql.errors.UsageException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code %s} and {@code %(name)s} placeholders with escaped SQL literals.
 * {@code %%} stands for a literal percent sign.
 */
public final class ParameterEscaper {

    private static final Pattern PLACEHOLDER = Pattern.compile("%%|%\\((\\w+)\\)s|%s");

    private ParameterEscaper() {
    }

    public static String bind(String sql, List<?> parameters) {
        Matcher matcher = PLACEHOLDER.matcher(sql);
        StringBuilder bound = new StringBuilder();
        int next = 0;
        while (matcher.find()) {
            String replacement;
            if (matcher.group().equals("%%")) {
                replacement = "%";
            } else if (matcher.group(1) != null) {
                throw new UsageException("Named placeholder %(" + matcher.group(1) + ")s needs named parameters");
            } else {
                if (next >= parameters.size()) {
                    throw new UsageException("Not enough parameters for SQL: got " + parameters.size());
                }
                replacement = escape(parameters.get(next++));
            }
            matcher.appendReplacement(bound, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(bound);
        if (next != parameters.size()) {
            throw new UsageException("Too many parameters for SQL: got " + parameters.size() + ", used " + next);
        }
        return bound.toString();
    }

    public static String bind(String sql, Map<String, ?> parameters) {
        Matcher matcher = PLACEHOLDER.matcher(sql);
        StringBuilder bound = new StringBuilder();
        while (matcher.find()) {
            String replacement;
            if (matcher.group().equals("%%")) {
                replacement = "%";
            } else if (matcher.group(1) == null) {
                throw new UsageException("Positional placeholder %s needs positional parameters");
            } else {
                String name = matcher.group(1);
                if (!parameters.containsKey(name)) {
                    throw new UsageException("Missing parameter: " + name);
                }
                replacement = escape(parameters.get(name));
            }
            matcher.appendReplacement(bound, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(bound);
        return bound.toString();
    }

    /**
     * Renders one value as a SQL literal.
     */
    public static String escape(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? "TRUE" : "FALSE";
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof OffsetDateTime) {
            return quote(DateTimeFormatter.ISO_OFFSET_DATE_TIME.format((OffsetDateTime) value));
        }
        if (value instanceof ZonedDateTime) {
            return quote(DateTimeFormatter.ISO_OFFSET_DATE_TIME.format((ZonedDateTime) value));
        }
        if (value instanceof LocalDateTime || value instanceof LocalDate) {
            return quote(value.toString());
        }
        if (value instanceof Collection) {
            List<String> elements = new ArrayList<>();
            for (Object element : (Collection<?>) value) {
                elements.add(escape(element));
            }
            return "(" + String.join(", ", elements) + ")";
        }
        String text = value.toString();
        if (text.equals("*")) {
            return text;
        }
        return quote(text);
    }

    private static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }
}
