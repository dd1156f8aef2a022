package com.sievesql.binding;

import com.sievesql.syntax.Syntax;

/**
 * Gives the result of a closed recipe the name it was looked up by.
 */
public final class AliasBinding extends WrappingBinding {

    public AliasBinding(Binding base, Syntax syntax) {
        super(base, syntax);
    }
}
