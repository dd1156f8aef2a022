package com.sievesql.binding;

import com.sievesql.syntax.Syntax;
import com.sievesql.types.EntityDomain;

import java.util.List;
import java.util.Objects;

/**
 * The distinct values of the kernel expressions over the seed rows
 * ({@code seed ^ kernel}).
 */
public final class QuotientBinding extends ScopingBinding {

    private final Binding seed;
    private final List<Binding> kernels;

    public QuotientBinding(Binding base, Binding seed, List<Binding> kernels, Syntax syntax) {
        super(base, new EntityDomain(), syntax);
        this.seed = Objects.requireNonNull(seed, "seed must not be null");
        this.kernels = List.copyOf(kernels);
    }

    public Binding seed() {
        return seed;
    }

    public List<Binding> kernels() {
        return kernels;
    }
}
