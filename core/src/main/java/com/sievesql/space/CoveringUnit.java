package com.sievesql.space;

import com.sievesql.binding.Binding;

/**
 * A code over the seed of a covering space brought to the covering rows.
 */
public final class CoveringUnit extends CompoundUnit {

    public CoveringUnit(Code code, Space space, Binding binding) {
        super(code, space, binding);
        if (!(space.axis() instanceof CoveringSpace)) {
            throw new IllegalArgumentException("covering unit requires a covering space: " + space);
        }
    }

    /**
     * Returns the covering axis of the unit space.
     */
    public CoveringSpace covering() {
        return (CoveringSpace) space().axis();
    }

    @Override
    public CoveringUnit withSpace(Space space) {
        return new CoveringUnit(code(), space, binding());
    }

    @Override
    public CoveringUnit withCode(Code code) {
        return new CoveringUnit(code, space(), binding());
    }

    @Override
    protected Object[] basis() {
        return new Object[] {code(), space()};
    }

    @Override
    public String toString() {
        return "(" + code() + " % " + space() + ")";
    }
}
