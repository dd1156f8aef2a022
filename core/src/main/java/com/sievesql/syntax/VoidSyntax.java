package com.sievesql.syntax;

import com.sievesql.mark.Mark;

import java.util.List;

/**
 * The syntax of nodes that do not originate from the query, such as the root scope.
 */
public final class VoidSyntax extends Syntax {

    public VoidSyntax() {
        super(Mark.EMPTY);
    }

    @Override
    protected List<Object> basis() {
        return List.of();
    }

    @Override
    public String toString() {
        return "";
    }
}
