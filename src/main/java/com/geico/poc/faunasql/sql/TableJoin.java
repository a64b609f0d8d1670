package com.geico.poc.faunasql.sql;

import com.geico.poc.faunasql.errors.TranslationRejectedException;

/**
 * Link from a joined table back to the table named on the other side of its ON clause.
 * One side is always a primary key, the other the foreign key pointing at it.
 */
public class TableJoin {

    private final Column ownKey;
    private final Column neighborKey;

    public TableJoin(Column ownKey, Column neighborKey) {
        if (ownKey.isPrimaryKey() == neighborKey.isPrimaryKey()) {
            throw new TranslationRejectedException(
                "JOIN conditions must compare a primary key (id) with a foreign key, got "
                    + ownKey + " = " + neighborKey);
        }
        this.ownKey = ownKey;
        this.neighborKey = neighborKey;
    }

    public Column getOwnKey() {
        return ownKey;
    }

    public Column getNeighborKey() {
        return neighborKey;
    }

    public String getNeighborTable() {
        return neighborKey.getTableName();
    }

    /**
     * True when this table's id is referenced by a foreign key on the neighbor.
     */
    public boolean isJoinedById() {
        return ownKey.isPrimaryKey();
    }

    @Override
    public String toString() {
        return ownKey + " = " + neighborKey;
    }
}
