package com.sievesql.frame;

import com.sievesql.catalog.Table;
import com.sievesql.compiler.Term;

import java.util.Objects;

public final class TableFrame extends Frame {

    private final Table table;

    public TableFrame(Table table, int tag, Term term) {
        super(tag, term);
        this.table = Objects.requireNonNull(table, "table must not be null");
    }

    public Table table() {
        return table;
    }

    @Override
    protected Object[] basis() {
        return new Object[] {table};
    }

    @Override
    public String toString() {
        return "(" + tag() + ") " + table;
    }
}
