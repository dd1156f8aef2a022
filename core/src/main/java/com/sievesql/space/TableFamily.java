package com.sievesql.space;

import com.sievesql.catalog.Table;

import java.util.Objects;

/**
 * Rows of a catalog table.
 *
 * @param table the table
 */
public record TableFamily(Table table) implements Family {

    public TableFamily {
        Objects.requireNonNull(table, "table must not be null");
    }
}
