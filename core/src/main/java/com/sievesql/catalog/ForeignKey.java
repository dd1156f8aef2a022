package com.sievesql.catalog;

import java.util.List;
import java.util.Objects;

/**
 * A foreign key constraint from the origin columns to the target columns.
 *
 * @param origin the referring table
 * @param originColumns the referring columns
 * @param target the referred table
 * @param targetColumns the referred columns, in the same order
 * @param isPartial whether the constraint applies to a subset of rows only
 */
public record ForeignKey(Table origin, List<Column> originColumns,
                         Table target, List<Column> targetColumns, boolean isPartial) {

    public ForeignKey {
        Objects.requireNonNull(origin, "origin must not be null");
        Objects.requireNonNull(target, "target must not be null");
        originColumns = List.copyOf(originColumns);
        targetColumns = List.copyOf(targetColumns);
        if (originColumns.isEmpty() || originColumns.size() != targetColumns.size()) {
            throw new IllegalArgumentException(String.format(
                "foreign key %s -> %s must have matching non-empty column lists", origin, target));
        }
    }
}
