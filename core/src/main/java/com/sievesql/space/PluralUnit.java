package com.sievesql.space;

import com.sievesql.binding.Binding;

import java.util.Objects;

/**
 * A code over a plural space folded into one value per row of the space.
 */
public abstract class PluralUnit extends CompoundUnit {

    private final Space pluralSpace;

    protected PluralUnit(Code code, Space pluralSpace, Space space, Binding binding) {
        super(code, space, binding);
        this.pluralSpace = Objects.requireNonNull(pluralSpace, "pluralSpace must not be null");
    }

    public Space pluralSpace() {
        return pluralSpace;
    }

    @Override
    public abstract PluralUnit withCode(Code code);

    /**
     * Returns the same unit folding another plural space.
     */
    public abstract PluralUnit withPluralSpace(Space pluralSpace);

    @Override
    protected Object[] basis() {
        return new Object[] {code(), pluralSpace, space()};
    }
}
