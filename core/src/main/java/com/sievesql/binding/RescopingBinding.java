package com.sievesql.binding;

import com.sievesql.syntax.Syntax;

/**
 * A binding evaluated in another scope than the current one, produced when
 * a selector or a wildcard is expanded.
 */
public final class RescopingBinding extends ChainingBinding {

    private final Binding scope;

    public RescopingBinding(Binding base, Binding scope, Syntax syntax) {
        super(base, base.domain(), syntax);
        this.scope = scope;
    }

    public Binding scope() {
        return scope;
    }
}
