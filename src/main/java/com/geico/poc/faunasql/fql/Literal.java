package com.geico.poc.faunasql.fql;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Scalar constant: null, boolean, number, string, timestamp or date.
 */
public final class Literal extends Expr {

    public static final Literal NULL = new Literal(null);
    public static final Literal TRUE = new Literal(Boolean.TRUE);
    public static final Literal FALSE = new Literal(Boolean.FALSE);

    private final Object value;

    private Literal(Object value) {
        this.value = value;
    }

    public static Literal of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? TRUE : FALSE;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return new Literal(((Number) value).longValue());
        }
        if (value instanceof Float) {
            return new Literal(((Float) value).doubleValue());
        }
        if (value instanceof BigDecimal) {
            BigDecimal decimal = (BigDecimal) value;
            return decimal.scale() <= 0
                ? new Literal(decimal.longValueExact())
                : new Literal(decimal.doubleValue());
        }
        if (value instanceof Long || value instanceof Double || value instanceof String
                || value instanceof OffsetDateTime || value instanceof LocalDate) {
            return new Literal(value);
        }
        throw new IllegalArgumentException("Unsupported literal type: " + value.getClass().getName());
    }

    public Object getValue() {
        return value;
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(value, ((Literal) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }
}
