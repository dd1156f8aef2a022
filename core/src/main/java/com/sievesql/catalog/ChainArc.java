package com.sievesql.catalog;

import java.util.List;
import java.util.Objects;

/**
 * A link from a table to another table through a chain of joins.
 */
public record ChainArc(Table table, List<Join> joins) implements Arc {

    public ChainArc {
        Objects.requireNonNull(table, "table must not be null");
        joins = List.copyOf(joins);
        if (joins.isEmpty()) {
            throw new IllegalArgumentException("a chain must contain at least one join");
        }
    }

    public Table target() {
        return joins.get(joins.size() - 1).target();
    }

    public boolean isExpanding() {
        return joins.stream().allMatch(Join::isExpanding);
    }

    public boolean isContracting() {
        return joins.stream().allMatch(Join::isContracting);
    }
}
