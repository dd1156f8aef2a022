package com.sievesql.binding;

import com.sievesql.catalog.Table;
import com.sievesql.syntax.Syntax;
import com.sievesql.types.EntityDomain;

import java.util.Objects;

/**
 * A scope of table rows.
 */
public abstract class TableBinding extends ScopingBinding {

    private final Table table;

    protected TableBinding(Binding base, Table table, Syntax syntax) {
        super(base, new EntityDomain(), syntax);
        this.table = Objects.requireNonNull(table, "table must not be null");
    }

    public Table table() {
        return table;
    }
}
