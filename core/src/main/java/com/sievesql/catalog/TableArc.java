package com.sievesql.catalog;

import java.util.Objects;

/**
 * A table reachable from the home scope.
 */
public record TableArc(Table table) implements Arc {

    public TableArc {
        Objects.requireNonNull(table, "table must not be null");
    }
}
