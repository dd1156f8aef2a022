package com.sievesql.binding;

import com.sievesql.syntax.Syntax;
import com.sievesql.types.ListDomain;

/**
 * A list of output values: every value of the seed in the scope of the
 * base.
 */
public final class SegmentBinding extends Binding {

    private final Binding seed;

    public SegmentBinding(Binding base, Binding seed, ListDomain domain, Syntax syntax) {
        super(base, domain, syntax);
        this.seed = seed;
    }

    public Binding seed() {
        return seed;
    }

    @Override
    public ListDomain domain() {
        return (ListDomain) super.domain();
    }
}
