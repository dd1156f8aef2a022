package com.sievesql.binding;

import com.sievesql.syntax.Syntax;

/**
 * Evaluates in the base scope but resolves names in the target scope.
 * Used for the body of a calculated attribute.
 */
public class RerouteBinding extends WrappingBinding {

    private final Binding target;

    public RerouteBinding(Binding base, Binding target, Syntax syntax) {
        super(base, syntax);
        this.target = target;
    }

    public Binding target() {
        return target;
    }
}
