package com.sievesql.space;

import com.sievesql.binding.Binding;
import com.sievesql.catalog.Table;

/**
 * Rows of a table, either a free product with the base or a fiber joined
 * to it.
 */
public abstract class TableSpace extends Space {

    protected TableSpace(Space base, Table table, boolean isContracting, boolean isExpanding, Binding binding) {
        super(base, new TableFamily(table), isContracting, isExpanding, binding);
    }

    public Table table() {
        return ((TableFamily) family()).table();
    }

    @Override
    public boolean isAxis() {
        return true;
    }
}
