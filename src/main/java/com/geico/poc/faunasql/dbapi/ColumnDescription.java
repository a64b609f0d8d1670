package com.geico.poc.faunasql.dbapi;

/**
 * One entry of {@link Cursor#getDescription()}: the column name and type code. Display size,
 * internal size, precision and scale are unknown; every column is reported nullable.
 */
public class ColumnDescription {

    public static final String STRING = "STRING";
    public static final String NUMBER = "NUMBER";
    public static final String BOOLEAN = "BOOLEAN";
    public static final String DATE = "DATE";
    public static final String DATETIME = "DATETIME";
    public static final String UNKNOWN = "UNKNOWN";

    private final String name;
    private final String typeCode;

    public ColumnDescription(String name, String typeCode) {
        this.name = name;
        this.typeCode = typeCode;
    }

    public String getName() {
        return name;
    }

    public String getTypeCode() {
        return typeCode;
    }

    public Integer getDisplaySize() {
        return null;
    }

    public Integer getInternalSize() {
        return null;
    }

    public Integer getPrecision() {
        return null;
    }

    public Integer getScale() {
        return null;
    }

    public boolean isNullable() {
        return true;
    }

    @Override
    public String toString() {
        return "(" + name + ", " + typeCode + ", None, None, None, None, True)";
    }
}
