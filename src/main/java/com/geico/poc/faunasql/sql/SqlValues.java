package com.geico.poc.faunasql.sql;

import com.geico.poc.faunasql.errors.TranslationRejectedException;
import org.apache.calcite.sql.SqlBasicCall;
import org.apache.calcite.sql.SqlCharStringLiteral;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.SqlLiteral;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlNumericLiteral;
import org.apache.calcite.sql.type.SqlTypeName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Converts SQL literals into typed values: null, Boolean, Long, Double, String or
 * OffsetDateTime.
 */
public final class SqlValues {

    private static final Logger log = LoggerFactory.getLogger(SqlValues.class);

    private static final Pattern ISO_DATE_PREFIX = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}.*");
    private static final Pattern SPACE_SEPARATED_TIME = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}) (\\d{2}:.*)$");

    private SqlValues() {
    }

    /**
     * Converts a raw literal token, such as {@code NULL}, {@code 42}, {@code 1.5} or {@code 'Bob'}.
     */
    public static Object extract(String token) {
        if (token == null) {
            return null;
        }
        String value = token.trim();
        if (value.equalsIgnoreCase("NULL")) {
            return null;
        }
        if (value.equalsIgnoreCase("TRUE")) {
            return Boolean.TRUE;
        }
        if (value.equalsIgnoreCase("FALSE")) {
            return Boolean.FALSE;
        }
        if (value.length() >= 2 && value.startsWith("'") && value.endsWith("'")) {
            return fromQuotedString(value.substring(1, value.length() - 1).replace("''", "'"));
        }
        Number number = parseNumber(value);
        if (number != null) {
            return number;
        }
        return value;
    }

    /**
     * Converts the content of a quoted string. Numeric strings stay strings; anything that
     * reads as an ISO-8601 date or datetime becomes an {@link OffsetDateTime}.
     */
    public static Object fromQuotedString(String value) {
        if (parseNumber(value) != null) {
            return value;
        }
        OffsetDateTime dateTime = parseDateTime(value);
        return dateTime != null ? dateTime : value;
    }

    /**
     * Converts a Calcite literal node. A unary minus applied to a number is folded in.
     */
    public static Object extract(SqlNode node) {
        if (node instanceof SqlBasicCall && node.getKind() == SqlKind.MINUS_PREFIX) {
            SqlNode negated = ((SqlBasicCall) node).operand(0);
            Object operand = extract(negated);
            if (operand instanceof Long) {
                return -(Long) operand;
            }
            if (operand instanceof Double) {
                return -(Double) operand;
            }
            throw new TranslationRejectedException("Cannot negate non-numeric value: " + node);
        }
        if (!(node instanceof SqlLiteral)) {
            throw new TranslationRejectedException("Only literal values are supported, got: " + node);
        }

        SqlLiteral literal = (SqlLiteral) node;
        if (literal.getTypeName() == SqlTypeName.NULL) {
            return null;
        }
        if (literal.getTypeName() == SqlTypeName.BOOLEAN) {
            return literal.booleanValue();
        }
        if (literal instanceof SqlNumericLiteral) {
            SqlNumericLiteral numeric = (SqlNumericLiteral) literal;
            BigDecimal decimal = numeric.getValueAs(BigDecimal.class);
            if (!numeric.isExact() || decimal.scale() > 0) {
                return decimal.doubleValue();
            }
            try {
                return decimal.longValueExact();
            } catch (ArithmeticException e) {
                throw new TranslationRejectedException("Integer out of the 64-bit range: " + decimal, e);
            }
        }
        if (literal instanceof SqlCharStringLiteral) {
            return fromQuotedString(literal.getValueAs(String.class));
        }
        if (literal.getTypeName() == SqlTypeName.DATE || literal.getTypeName() == SqlTypeName.TIMESTAMP) {
            return fromQuotedString(literal.toValue());
        }
        throw new TranslationRejectedException("Unsupported literal type " + literal.getTypeName() + ": " + node);
    }

    public static boolean isLiteral(SqlNode node) {
        if (node instanceof SqlLiteral) {
            return true;
        }
        return node instanceof SqlBasicCall && node.getKind() == SqlKind.MINUS_PREFIX
            && ((SqlBasicCall) node).operand(0) instanceof SqlNumericLiteral;
    }

    private static Number parseNumber(String value) {
        if (value.contains(".")) {
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static OffsetDateTime parseDateTime(String value) {
        if (!ISO_DATE_PREFIX.matcher(value).matches()) {
            return null;
        }
        String iso = SPACE_SEPARATED_TIME.matcher(value).replaceFirst("$1T$2");
        try {
            return OffsetDateTime.parse(iso);
        } catch (DateTimeParseException e) {
            log.trace("{} is not an offset datetime", value);
        }
        try {
            LocalDateTime local = LocalDateTime.parse(iso);
            log.warn("Datetime '{}' has no timezone; treating it as UTC", value);
            return local.atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.trace("{} is not a local datetime", value);
        }
        try {
            LocalDate date = LocalDate.parse(iso);
            log.warn("Date '{}' has no time or timezone; treating it as midnight UTC", value);
            return date.atStartOfDay().atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
