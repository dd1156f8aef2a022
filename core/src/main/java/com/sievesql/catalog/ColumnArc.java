package com.sievesql.catalog;

import java.util.Objects;

/**
 * A column of a table.
 *
 * @param table the table
 * @param column the column
 * @param link the link the column is the only origin column of, or null;
 *             either a {@link ChainArc} or an {@link AmbiguousArc}
 */
public record ColumnArc(Table table, Column column, Arc link) implements Arc {

    public ColumnArc {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(column, "column must not be null");
    }

    /**
     * Returns the same arc without the link.
     */
    public ColumnArc withoutLink() {
        return link == null ? this : new ColumnArc(table, column, null);
    }
}
