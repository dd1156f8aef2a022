package com.sievesql.binding;

import com.sievesql.syntax.Syntax;

import java.util.List;

/**
 * The seed rows whose identity equals the given value ({@code seed[id]}).
 *
 * <p>The value mirrors the shape of the identity: each item is either a
 * scalar binding or a nested {@code List} for a linked identity.
 */
public final class LocatorBinding extends ScopingBinding {

    private final Binding seed;
    private final IdentityBinding identity;
    private final List<Object> value;

    public LocatorBinding(Binding base, Binding seed, IdentityBinding identity, List<Object> value, Syntax syntax) {
        super(base, seed.domain(), syntax);
        this.seed = seed;
        this.identity = identity;
        this.value = List.copyOf(value);
    }

    public Binding seed() {
        return seed;
    }

    public IdentityBinding identity() {
        return identity;
    }

    public List<Object> value() {
        return value;
    }
}
