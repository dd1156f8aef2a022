package com.sievesql.syntax;

import com.sievesql.mark.Mark;

import java.util.List;
import java.util.Objects;

/**
 * An expression in parentheses.
 */
public final class GroupSyntax extends Syntax {

    private final Syntax branch;

    public GroupSyntax(Syntax branch, Mark mark) {
        super(mark);
        this.branch = Objects.requireNonNull(branch, "branch must not be null");
    }

    public Syntax branch() {
        return branch;
    }

    @Override
    protected List<Object> basis() {
        return List.of(branch);
    }

    @Override
    public String toString() {
        return "(" + branch + ")";
    }
}
