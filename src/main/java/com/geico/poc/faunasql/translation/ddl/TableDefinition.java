package com.geico.poc.faunasql.translation.ddl;

import com.geico.poc.faunasql.schema.FieldMetadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parsed CREATE TABLE statement. The {@code id} column is never part of {@link #getFields()}.
 */
public class TableDefinition {

    private final String name;
    private final boolean ifNotExists;
    private final List<FieldMetadata> fields;

    public TableDefinition(String name, boolean ifNotExists, List<FieldMetadata> fields) {
        this.name = name;
        this.ifNotExists = ifNotExists;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public String getName() {
        return name;
    }

    public boolean isIfNotExists() {
        return ifNotExists;
    }

    public List<FieldMetadata> getFields() {
        return fields;
    }

    public FieldMetadata getField(String fieldName) {
        for (FieldMetadata field : fields) {
            if (field.getName().equals(fieldName)) {
                return field;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "TableDefinition{" + name + (ifNotExists ? " IF NOT EXISTS" : "") + ", fields=" + fields + "}";
    }
}
