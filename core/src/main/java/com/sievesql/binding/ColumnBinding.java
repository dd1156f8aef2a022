package com.sievesql.binding;

import com.sievesql.catalog.Column;
import com.sievesql.syntax.Syntax;

import java.util.Objects;

/**
 * A table column. When the column is the origin of a foreign key, the
 * link binding lets the column be used as a scope of the referred table.
 */
public final class ColumnBinding extends ScopingBinding {

    private final Column column;
    private final Binding link;

    public ColumnBinding(Binding base, Column column, Binding link, Syntax syntax) {
        super(base, column.domain(), syntax);
        this.column = Objects.requireNonNull(column, "column must not be null");
        this.link = link;
    }

    public Column column() {
        return column;
    }

    /**
     * Returns the scope of the referred table, or null.
     */
    public Binding link() {
        return link;
    }
}
