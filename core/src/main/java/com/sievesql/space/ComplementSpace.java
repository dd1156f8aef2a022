package com.sievesql.space;

import com.sievesql.binding.Binding;

import java.util.List;

/**
 * The seed rows that make up each row of a quotient base ({@code ^}).
 */
public final class ComplementSpace extends CoveringSpace {

    public ComplementSpace(Space base, Binding binding) {
        this(base, List.of(), binding);
    }

    public ComplementSpace(Space base, List<Code> companions, Binding binding) {
        super(base, quotient(base).seed().family(), quotient(base).seed(), quotient(base).ground(),
                false, true, companions, binding);
    }

    private static QuotientFamily quotient(Space base) {
        if (!(base.family() instanceof QuotientFamily family)) {
            throw new IllegalArgumentException("complement requires a quotient base: " + base);
        }
        return family;
    }

    public List<Code> kernels() {
        return quotient(base()).kernels();
    }

    @Override
    public Space withBase(Space base) {
        return new ComplementSpace(base, companions(), binding());
    }

    @Override
    public CoveringSpace withCompanions(List<Code> companions) {
        return new ComplementSpace(base(), companions, binding());
    }

    @Override
    protected Object[] basis() {
        return new Object[] {base()};
    }

    @Override
    public String toString() {
        return "(" + base() + " . ^)";
    }
}
