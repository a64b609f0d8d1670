package com.geico.poc.faunasql.schema;

/**
 * The index naming convention shared by table provisioning and query compilation.
 *
 * Names read {@code table[_by_column]_kind[_to_foreignKey]}, for example
 * {@code users_all}, {@code users_by_name_term} or {@code posts_by_user_id_ref_to_user_id}.
 */
public final class IndexNames {

    private IndexNames() {
    }

    public static String indexName(String table) {
        return indexName(table, null, IndexKind.ALL, null);
    }

    public static String indexName(String table, IndexKind kind) {
        return indexName(table, null, kind, null);
    }

    public static String indexName(String table, String column, IndexKind kind) {
        return indexName(table, column, kind, null);
    }

    /**
     * @param table      collection name
     * @param column     indexed field; required except for ALL and REF, forbidden for ALL
     * @param kind       index kind
     * @param foreignKey name of the foreign-key field whose values the index returns; REF only
     */
    public static String indexName(String table, String column, IndexKind kind, String foreignKey) {
        if (table == null || table.isEmpty()) {
            throw new IllegalArgumentException("Index name requires a table name");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Index name requires an index kind");
        }
        if (column == null && kind != IndexKind.ALL && kind != IndexKind.REF) {
            throw new IllegalArgumentException(kind.suffix() + " indexes require a column name");
        }
        if (column != null && kind == IndexKind.ALL) {
            throw new IllegalArgumentException("all indexes cannot have a column name, got " + column);
        }
        if (foreignKey != null && kind != IndexKind.REF) {
            throw new IllegalArgumentException(
                "Only ref indexes can have a foreign key, got " + kind.suffix() + " index with " + foreignKey);
        }

        StringBuilder name = new StringBuilder(table);
        if (column != null) {
            name.append("_by_").append(column);
        }
        name.append('_').append(kind.suffix());
        if (foreignKey != null) {
            name.append("_to_").append(foreignKey);
        }
        return name.toString();
    }
}
