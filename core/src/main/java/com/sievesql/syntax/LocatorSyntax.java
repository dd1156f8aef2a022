package com.sievesql.syntax;

import com.sievesql.mark.Mark;

import java.util.List;
import java.util.Objects;

/**
 * A row of a table picked by its identity: {@code table[label.label]}.
 */
public final class LocatorSyntax extends Syntax {

    private final Syntax lbranch;
    private final LocationSyntax rbranch;

    public LocatorSyntax(Syntax lbranch, LocationSyntax rbranch, Mark mark) {
        super(mark);
        this.lbranch = Objects.requireNonNull(lbranch, "lbranch must not be null");
        this.rbranch = Objects.requireNonNull(rbranch, "rbranch must not be null");
    }

    public Syntax lbranch() {
        return lbranch;
    }

    public LocationSyntax rbranch() {
        return rbranch;
    }

    @Override
    protected List<Object> basis() {
        return List.of(lbranch, rbranch);
    }

    @Override
    public String toString() {
        return lbranch.toString() + rbranch;
    }
}
