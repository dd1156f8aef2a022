package com.sievesql.space;

import com.sievesql.binding.Binding;
import com.sievesql.types.Domain;

import java.util.List;
import java.util.Objects;

/**
 * A scalar expression over spaces.
 *
 * <p>A code is built of formulas over literals and {@link Unit}s; a unit
 * is the only kind of code that refers to a space, so {@link #units()}
 * tells where the code can be evaluated.
 */
public abstract class Code extends Expression {

    private final Domain domain;

    protected Code(Domain domain, Binding binding) {
        super(binding);
        this.domain = Objects.requireNonNull(domain, "domain must not be null");
    }

    public Domain domain() {
        return domain;
    }

    /**
     * Returns the units this code is composed of.
     */
    public List<Unit> units() {
        return List.of();
    }
}
