package com.sievesql.catalog;

import java.util.List;
import java.util.Objects;

/**
 * Navigates from the referred table to the referring table.
 *
 * <p>Never expanding; contracting when the referring columns form a unique key.
 */
public record ReverseJoin(ForeignKey foreignKey) implements Join {

    public ReverseJoin {
        Objects.requireNonNull(foreignKey, "foreignKey must not be null");
    }

    @Override
    public Table origin() {
        return foreignKey.target();
    }

    @Override
    public Table target() {
        return foreignKey.origin();
    }

    @Override
    public List<Column> originColumns() {
        return foreignKey.targetColumns();
    }

    @Override
    public List<Column> targetColumns() {
        return foreignKey.originColumns();
    }

    @Override
    public boolean isExpanding() {
        return false;
    }

    @Override
    public boolean isContracting() {
        Table referring = foreignKey.origin();
        List<Column> columns = foreignKey.originColumns();
        if (referring.primaryKey() != null && isCovered(referring.primaryKey(), columns)) {
            return true;
        }
        for (UniqueKey key : referring.uniqueKeys()) {
            if (!key.isPartial() && isCovered(key, columns)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isCovered(UniqueKey key, List<Column> columns) {
        return columns.containsAll(key.originColumns());
    }

    @Override
    public boolean isDirect() {
        return false;
    }

    @Override
    public Join reverse() {
        return new DirectJoin(foreignKey);
    }

    @Override
    public String toString() {
        return origin() + " <- " + target();
    }
}
