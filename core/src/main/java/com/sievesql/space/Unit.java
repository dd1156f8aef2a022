package com.sievesql.space;

import com.sievesql.binding.Binding;
import com.sievesql.types.Domain;

import java.util.List;
import java.util.Objects;

/**
 * A code bound to a space: a value computed for every row of the space.
 *
 * <p>Primitive units are table columns; compound units wrap another code
 * that must be evaluated elsewhere and then brought into the space.
 */
public abstract class Unit extends Code {

    private final Space space;

    protected Unit(Space space, Domain domain, Binding binding) {
        super(domain, binding);
        this.space = Objects.requireNonNull(space, "space must not be null");
    }

    public Space space() {
        return space;
    }

    @Override
    public List<Unit> units() {
        return List.of(this);
    }

    /**
     * Returns true if the unit has a single value for every row of the space.
     */
    public boolean isSingular(Space other) {
        return other.spans(space);
    }

    /**
     * Returns the same unit attached to another space.
     */
    public abstract Unit withSpace(Space space);
}
