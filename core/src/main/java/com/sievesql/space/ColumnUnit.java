package com.sievesql.space;

import com.sievesql.binding.Binding;
import com.sievesql.catalog.Column;

/**
 * A column of the table the space ends in.
 */
public final class ColumnUnit extends Unit {

    private final Column column;

    public ColumnUnit(Column column, Space space, Binding binding) {
        super(space, column.domain(), binding);
        this.column = column;
    }

    public Column column() {
        return column;
    }

    @Override
    public ColumnUnit withSpace(Space space) {
        return new ColumnUnit(column, space, binding());
    }

    public ColumnUnit with(Column column, Space space) {
        return new ColumnUnit(column, space, binding());
    }

    @Override
    protected Object[] basis() {
        return new Object[] {column, space()};
    }

    @Override
    public String toString() {
        return space() + "." + column.name();
    }
}
