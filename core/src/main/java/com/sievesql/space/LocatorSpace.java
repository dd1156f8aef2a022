package com.sievesql.space;

import com.sievesql.binding.Binding;

import java.util.List;
import java.util.Objects;

/**
 * The seed row whose identity matches a literal value ({@code seed[id]}).
 *
 * <p>The filter compares the identity codes of the seed with the located
 * values.
 */
public final class LocatorSpace extends CoveringSpace {

    private final Code filter;

    public LocatorSpace(Space base, Space seed, Code filter, Binding binding) {
        this(base, seed, filter, List.of(), binding);
    }

    public LocatorSpace(Space base, Space seed, Code filter, List<Code> companions, Binding binding) {
        super(base, seed.family(), seed, groundOf(base, seed),
                isContracting(base, seed), false, companions, binding);
        this.filter = Objects.requireNonNull(filter, "filter must not be null");
    }

    private static boolean isContracting(Space base, Space seed) {
        Space axis = seed.axis();
        return axis.base() == null || base.spans(axis.base());
    }

    public Code filter() {
        return filter;
    }

    @Override
    public Space withBase(Space base) {
        return new LocatorSpace(base, seed(), filter, companions(), binding());
    }

    @Override
    public CoveringSpace withCompanions(List<Code> companions) {
        return new LocatorSpace(base(), seed(), filter, companions, binding());
    }

    @Override
    protected Object[] basis() {
        return new Object[] {base(), seed(), filter};
    }

    @Override
    public String toString() {
        return "(" + base() + " . (" + seed() + " ? " + filter + "))";
    }
}
