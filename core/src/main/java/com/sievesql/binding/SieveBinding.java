package com.sievesql.binding;

import com.sievesql.syntax.Syntax;

/**
 * Rows of the base satisfying a condition ({@code base ? filter}).
 */
public final class SieveBinding extends ChainingBinding {

    private final Binding filter;

    public SieveBinding(Binding base, Binding filter, Syntax syntax) {
        super(base, base.domain(), syntax);
        this.filter = filter;
    }

    public Binding filter() {
        return filter;
    }
}
