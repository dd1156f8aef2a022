package com.sievesql.binding;

import com.sievesql.syntax.Syntax;

/**
 * Resolves references, but not attributes, in the target scope.
 */
public final class ReferenceRerouteBinding extends WrappingBinding {

    private final Binding target;

    public ReferenceRerouteBinding(Binding base, Binding target, Syntax syntax) {
        super(base, syntax);
        this.target = target;
    }

    public Binding target() {
        return target;
    }
}
