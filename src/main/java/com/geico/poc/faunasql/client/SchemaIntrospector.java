package com.geico.poc.faunasql.client;

import com.geico.poc.faunasql.errors.SchemaNotReadyException;
import com.geico.poc.faunasql.schema.IndexKind;
import com.geico.poc.faunasql.schema.IndexNames;
import com.geico.poc.faunasql.schema.InformationSchema;
import com.geico.poc.faunasql.sql.Column;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Reads table schema back out of the information-schema collections with plain SQL.
 * Before the first CREATE TABLE those collections do not exist and every lookup is empty.
 */
@Component
public class SchemaIntrospector {

    private static final Logger log = LoggerFactory.getLogger(SchemaIntrospector.class);

    private final FaunaClient client;

    @Autowired
    public SchemaIntrospector(FaunaClient client) {
        this.client = client;
    }

    public List<String> listTables() {
        List<String> tables = new ArrayList<>();
        for (Map<String, Object> row : query(
                "SELECT " + InformationSchema.TABLES + ".name_ FROM " + InformationSchema.TABLES
                    + " ORDER BY " + InformationSchema.TABLES + ".name_")) {
            tables.add(String.valueOf(row.get("name_")));
        }
        return tables;
    }

    public boolean hasTable(String table) {
        return !query("SELECT name_ FROM " + InformationSchema.TABLES + " WHERE name_ = " + quote(table)).isEmpty();
    }

    /**
     * One row per column, {@code id} first: name_, type_, nullable_, default_, unique_.
     */
    public List<Map<String, Object>> getColumns(String table) {
        return query("SELECT name_, type_, nullable_, default_, unique_ FROM " + InformationSchema.COLUMNS
            + " WHERE table_name_ = " + quote(table));
    }

    public List<Map<String, Object>> getIndexes(String table) {
        return query("SELECT name_, column_names_, unique_, constrained_columns_, referred_table_, referred_columns_"
            + " FROM " + InformationSchema.INDEXES + " WHERE table_name_ = " + quote(table));
    }

    public List<String> getPrimaryKey(String table) {
        return hasTable(table) ? Collections.singletonList(Column.ID) : Collections.emptyList();
    }

    /**
     * Foreign keys as rows of constrained_columns_, referred_table_, referred_columns_.
     */
    public List<Map<String, Object>> getForeignKeys(String table) {
        List<Map<String, Object>> foreignKeys = new ArrayList<>();
        for (Map<String, Object> index : getIndexes(table)) {
            Object constrained = index.get("constrained_columns_");
            if (constrained != null
                && IndexNames.indexName(table, constrained.toString(), IndexKind.REF).equals(index.get("name_"))) {
                foreignKeys.add(index);
            }
        }
        return foreignKeys;
    }

    private List<Map<String, Object>> query(String sql) {
        try {
            return client.introspect(sql).getRows();
        } catch (SchemaNotReadyException e) {
            log.debug("Information schema not available yet ({}); returning no rows", e.getMessage());
            return Collections.emptyList();
        }
    }

    private static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
