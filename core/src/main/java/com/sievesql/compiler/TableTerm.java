package com.sievesql.compiler;

import com.sievesql.catalog.Table;
import com.sievesql.space.Space;
import com.sievesql.space.TableFamily;
import com.sievesql.space.Unit;

import java.util.List;
import java.util.Map;

/**
 * A table read as is.
 */
public final class TableTerm extends Term {

    private final Table table;

    public TableTerm(int tag, Space space, Map<Unit, Integer> routes) {
        super(tag, List.of(), space, space, routes);
        if (!(space.family() instanceof TableFamily family)) {
            throw new IllegalArgumentException("table term requires a table space: " + space);
        }
        this.table = family.table();
    }

    public Table table() {
        return table;
    }

    @Override
    public String toString() {
        return table.toString();
    }
}
