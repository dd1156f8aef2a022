package com.sievesql.catalog;

import java.util.List;
import java.util.Objects;

/**
 * A primary or unique key constraint.
 *
 * @param origin the constrained table
 * @param originColumns the key columns, in key order
 * @param isPrimary whether this is the primary key
 * @param isPartial whether the constraint applies to a subset of rows only
 */
public record UniqueKey(Table origin, List<Column> originColumns, boolean isPrimary, boolean isPartial) {

    public UniqueKey {
        Objects.requireNonNull(origin, "origin must not be null");
        originColumns = List.copyOf(originColumns);
        if (originColumns.isEmpty()) {
            throw new IllegalArgumentException("a unique key must have at least one column");
        }
    }
}
