package com.sievesql.space;

import com.sievesql.binding.Binding;
import com.sievesql.catalog.Table;

import java.util.Objects;

/**
 * All rows of a table for every row of a scalar base.
 */
public final class DirectTableSpace extends TableSpace {

    public DirectTableSpace(Space base, Table table, Binding binding) {
        super(base, Objects.requireNonNull(table, "table must not be null"), false, false, binding);
    }

    @Override
    public Space withBase(Space base) {
        return new DirectTableSpace(base, table(), binding());
    }

    @Override
    protected Object[] basis() {
        return new Object[] {base(), table()};
    }

    @Override
    public String toString() {
        return "(" + base() + " * " + table() + ")";
    }
}
