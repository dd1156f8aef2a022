package com.sievesql.binding;

import com.sievesql.syntax.Syntax;

/**
 * A chaining binding with the same domain as its base.
 *
 * <p>Used as is for parenthesized expressions and for {@code root()} and
 * {@code this()}.
 */
public class WrappingBinding extends ChainingBinding {

    public WrappingBinding(Binding base, Syntax syntax) {
        super(base, base.domain(), syntax);
    }
}
