package com.sievesql.space;

import com.sievesql.binding.Binding;

import java.util.List;

/**
 * The seed rows reattached to an unrelated base, used when a scope is
 * referenced outside the place it was defined in.
 */
public final class MonikerSpace extends CoveringSpace {

    public MonikerSpace(Space base, Space seed, Binding binding) {
        this(base, seed, List.of(), binding);
    }

    public MonikerSpace(Space base, Space seed, List<Code> companions, Binding binding) {
        super(base, seed.family(), seed, groundOf(base, seed),
                base.spans(seed), seed.dominates(base), companions, binding);
    }

    @Override
    public Space withBase(Space base) {
        return new MonikerSpace(base, seed(), companions(), binding());
    }

    @Override
    public CoveringSpace withCompanions(List<Code> companions) {
        return new MonikerSpace(base(), seed(), companions, binding());
    }

    @Override
    protected Object[] basis() {
        return new Object[] {base(), seed()};
    }

    @Override
    public String toString() {
        return "(" + base() + " . (" + seed() + "))";
    }
}
