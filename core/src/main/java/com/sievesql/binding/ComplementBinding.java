package com.sievesql.binding;

import com.sievesql.syntax.Syntax;

/**
 * The seed rows belonging to a quotient row ({@code ^}).
 */
public final class ComplementBinding extends ScopingBinding {

    private final QuotientBinding quotient;

    public ComplementBinding(Binding base, QuotientBinding quotient, Syntax syntax) {
        super(base, quotient.seed().domain(), syntax);
        this.quotient = quotient;
    }

    public QuotientBinding quotient() {
        return quotient;
    }
}
