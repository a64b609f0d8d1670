package com.geico.poc.faunasql.schema;

import com.geico.poc.faunasql.fql.Expr;
import com.geico.poc.faunasql.fql.Fql;

import java.util.Objects;

/**
 * Schema of one user-declared field, as stored in the collection's
 * {@code data.metadata.fields} array.
 */
public class FieldMetadata {

    private final String name;
    private final String type;
    private final boolean unique;
    private final boolean notNull;
    private final Object defaultValue;
    private final ForeignKeyReference references;

    public FieldMetadata(String name, String type, boolean unique, boolean notNull,
                         Object defaultValue, ForeignKeyReference references) {
        this.name = name;
        this.type = type;
        this.unique = unique;
        this.notNull = notNull;
        this.defaultValue = defaultValue;
        this.references = references;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public boolean isUnique() {
        return unique;
    }

    public boolean isNotNull() {
        return notNull;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public ForeignKeyReference getReferences() {
        return references;
    }

    public boolean isForeignKey() {
        return references != null;
    }

    public FieldMetadata withUnique(boolean unique) {
        return new FieldMetadata(name, type, unique, notNull, defaultValue, references);
    }

    public FieldMetadata withNotNull(boolean notNull) {
        return new FieldMetadata(name, type, unique, notNull, defaultValue, references);
    }

    public FieldMetadata withReferences(ForeignKeyReference references) {
        return new FieldMetadata(name, type, unique, notNull, defaultValue, references);
    }

    public Expr toExpr() {
        return Fql.obj(
            "name", name,
            "unique", unique,
            "not_null", notNull,
            "default", defaultValue,
            "type", type,
            "references", references == null
                ? Fql.NULL
                : Fql.obj("table", references.getTable(), "column", references.getColumn()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FieldMetadata that = (FieldMetadata) o;
        return unique == that.unique && notNull == that.notNull
            && Objects.equals(name, that.name) && Objects.equals(type, that.type)
            && Objects.equals(defaultValue, that.defaultValue)
            && Objects.equals(references, that.references);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, unique, notNull, defaultValue, references);
    }

    @Override
    public String toString() {
        return "FieldMetadata{" + name + " " + type
            + (unique ? " UNIQUE" : "") + (notNull ? " NOT NULL" : "")
            + (defaultValue != null ? " DEFAULT " + defaultValue : "")
            + (references != null ? " REFERENCES " + references : "") + "}";
    }
}
