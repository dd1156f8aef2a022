package com.sievesql.syntax;

import com.sievesql.mark.Mark;

import java.util.Arrays;
import java.util.List;

/**
 * All output columns {@code *}, or the column at a position {@code *N}.
 */
public final class WildcardSyntax extends Syntax {

    private final NumberSyntax index;

    public WildcardSyntax(NumberSyntax index, Mark mark) {
        super(mark);
        this.index = index;
    }

    /**
     * Returns the 1-based column position, or null for all columns.
     */
    public NumberSyntax index() {
        return index;
    }

    @Override
    protected List<Object> basis() {
        return Arrays.asList(index);
    }

    @Override
    public String toString() {
        return index != null ? "*" + index : "*";
    }
}
