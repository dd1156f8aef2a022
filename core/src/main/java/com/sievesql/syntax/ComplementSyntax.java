package com.sievesql.syntax;

import com.sievesql.mark.Mark;

import java.util.List;

/**
 * The rows of a quotient group: {@code ^}.
 */
public final class ComplementSyntax extends Syntax {

    public ComplementSyntax(Mark mark) {
        super(mark);
    }

    @Override
    protected List<Object> basis() {
        return List.of();
    }

    @Override
    public String toString() {
        return "^";
    }
}
