package com.sievesql.frame;

import com.sievesql.catalog.Column;
import com.sievesql.space.Expression;

import java.util.Objects;

/**
 * A column of the table frame with the given tag.
 */
public final class ColumnPhrase extends Phrase {

    private final int tag;
    private final Column column;

    public ColumnPhrase(int tag, Column column, boolean isNullable, Expression expression) {
        super(column.domain(), isNullable, expression);
        this.tag = tag;
        this.column = Objects.requireNonNull(column, "column must not be null");
    }

    public int tag() {
        return tag;
    }

    public Column column() {
        return column;
    }

    @Override
    public Phrase withNullable(boolean isNullable) {
        return new ColumnPhrase(tag, column, isNullable, expression());
    }

    @Override
    protected Object[] basis() {
        return new Object[] {tag, column};
    }

    @Override
    public String toString() {
        return "(" + tag + ")." + column.name();
    }
}
