package com.sievesql.space;

import com.sievesql.binding.Binding;
import com.sievesql.types.Domain;

import java.util.List;
import java.util.Objects;

/**
 * An explicit type conversion.
 */
public final class CastCode extends Code {

    private final Code base;

    public CastCode(Code base, Domain domain, Binding binding) {
        super(domain, binding);
        this.base = Objects.requireNonNull(base, "base must not be null");
    }

    public Code base() {
        return base;
    }

    @Override
    public List<Unit> units() {
        return base.units();
    }

    @Override
    protected Object[] basis() {
        return new Object[] {base, domain()};
    }

    @Override
    public String toString() {
        return "(" + base + " -> " + domain() + ")";
    }
}
