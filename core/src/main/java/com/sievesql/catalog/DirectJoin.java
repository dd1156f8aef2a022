package com.sievesql.catalog;

import java.util.List;
import java.util.Objects;

/**
 * Navigates from the referring table to the referred table.
 *
 * <p>Always contracting; expanding when no origin column is nullable.
 */
public record DirectJoin(ForeignKey foreignKey) implements Join {

    public DirectJoin {
        Objects.requireNonNull(foreignKey, "foreignKey must not be null");
    }

    @Override
    public Table origin() {
        return foreignKey.origin();
    }

    @Override
    public Table target() {
        return foreignKey.target();
    }

    @Override
    public List<Column> originColumns() {
        return foreignKey.originColumns();
    }

    @Override
    public List<Column> targetColumns() {
        return foreignKey.targetColumns();
    }

    @Override
    public boolean isExpanding() {
        if (foreignKey.isPartial()) {
            return false;
        }
        for (Column column : foreignKey.originColumns()) {
            if (column.isNullable()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean isContracting() {
        return true;
    }

    @Override
    public boolean isDirect() {
        return true;
    }

    @Override
    public Join reverse() {
        return new ReverseJoin(foreignKey);
    }

    @Override
    public String toString() {
        return origin() + " -> " + target();
    }
}
