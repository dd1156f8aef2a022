package com.sievesql.space;

import com.sievesql.binding.Binding;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Distinct kernel values of the seed rows attached to each base row.
 *
 * <p>Without kernels the quotient has exactly one row per base row.
 */
public final class QuotientSpace extends Space {

    public QuotientSpace(Space base, Space seed, List<Code> kernels, Binding binding) {
        super(base, new QuotientFamily(seed, groundOf(base, seed), kernels),
                kernels.isEmpty(), base.isRoot() && kernels.isEmpty(), binding);
    }

    private static Space groundOf(Space base, Space seed) {
        Space ground = seed;
        while (!base.spans(ground.base())) {
            ground = ground.base();
        }
        return ground;
    }

    @Override
    public QuotientFamily family() {
        return (QuotientFamily) super.family();
    }

    public Space seed() {
        return family().seed();
    }

    public Space ground() {
        return family().ground();
    }

    public List<Code> kernels() {
        return family().kernels();
    }

    @Override
    public boolean isAxis() {
        return true;
    }

    @Override
    public Space withBase(Space base) {
        return new QuotientSpace(base, seed(), kernels(), binding());
    }

    @Override
    protected Object[] basis() {
        return new Object[] {base(), seed(), kernels()};
    }

    @Override
    public String toString() {
        return "(" + base() + " . (" + seed() + " ^ {"
                + kernels().stream().map(String::valueOf).collect(Collectors.joining(", ")) + "}))";
    }
}
