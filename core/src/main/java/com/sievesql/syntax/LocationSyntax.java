package com.sievesql.syntax;

import com.sievesql.mark.Mark;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The identity part of a locator: labels separated by {@code .}, where a
 * label is a string or a nested, bracketed location.
 */
public final class LocationSyntax extends Syntax {

    private final List<Syntax> branches;
    private final int arity;

    public LocationSyntax(List<Syntax> branches, Mark mark) {
        super(mark);
        this.branches = List.copyOf(branches);
        int total = 0;
        for (Syntax branch : this.branches) {
            if (branch instanceof LocationSyntax location) {
                total += location.arity;
            } else if (branch instanceof StringSyntax) {
                total += 1;
            } else {
                throw new IllegalArgumentException("a location label must be a string or a location");
            }
        }
        this.arity = total;
    }

    public List<Syntax> branches() {
        return branches;
    }

    /**
     * Returns the number of labels, counting nested locations flat.
     */
    public int arity() {
        return arity;
    }

    @Override
    protected List<Object> basis() {
        return List.of(branches);
    }

    @Override
    public String toString() {
        return branches.stream().map(Syntax::toString).collect(Collectors.joining(".", "[", "]"));
    }
}
