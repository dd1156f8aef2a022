package com.sievesql.binding;

import com.sievesql.syntax.Syntax;

/**
 * A kernel value of a quotient, used inside the quotient scope.
 */
public final class KernelBinding extends ScopingBinding {

    private final QuotientBinding quotient;
    private final int index;

    public KernelBinding(Binding base, QuotientBinding quotient, int index, Syntax syntax) {
        super(base, quotient.kernels().get(index).domain(), syntax);
        this.quotient = quotient;
        this.index = index;
    }

    public QuotientBinding quotient() {
        return quotient;
    }

    public int index() {
        return index;
    }
}
