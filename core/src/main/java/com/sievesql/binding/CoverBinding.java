package com.sievesql.binding;

import com.sievesql.syntax.Syntax;

/**
 * The seed rows attached to the enclosing scope by identity
 * ({@code moniker(seed)}).
 */
public final class CoverBinding extends ScopingBinding {

    private final Binding seed;

    public CoverBinding(Binding base, Binding seed, Syntax syntax) {
        super(base, seed.domain(), syntax);
        this.seed = seed;
    }

    public Binding seed() {
        return seed;
    }
}
