package com.sievesql.syntax;

import com.sievesql.mark.Mark;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A selector {@code lbranch{rbranch, ...}}; the left branch is absent in a bare selector.
 */
public final class SelectorSyntax extends Syntax {

    private final Syntax lbranch;
    private final List<Syntax> rbranches;

    public SelectorSyntax(Syntax lbranch, List<Syntax> rbranches, Mark mark) {
        super(mark);
        this.lbranch = lbranch;
        this.rbranches = List.copyOf(rbranches);
    }

    public Syntax lbranch() {
        return lbranch;
    }

    public List<Syntax> rbranches() {
        return rbranches;
    }

    /**
     * Returns a copy of this selector attached to the given left branch.
     */
    public SelectorSyntax withLbranch(Syntax newLbranch, Mark newMark) {
        return new SelectorSyntax(newLbranch, rbranches, newMark);
    }

    @Override
    protected List<Object> basis() {
        return Arrays.asList(lbranch, rbranches);
    }

    @Override
    public String toString() {
        String items = rbranches.stream().map(Syntax::toString).collect(Collectors.joining(","));
        return (lbranch != null ? lbranch.toString() : "") + "{" + items + "}";
    }
}
