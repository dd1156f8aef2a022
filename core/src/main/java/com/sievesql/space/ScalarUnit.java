package com.sievesql.space;

import com.sievesql.binding.Binding;

/**
 * A code evaluated once per row of the space, typically an aggregate
 * wrapper or a Boolean indicator.
 */
public final class ScalarUnit extends CompoundUnit {

    public ScalarUnit(Code code, Space space, Binding binding) {
        super(code, space, binding);
    }

    @Override
    public ScalarUnit withSpace(Space space) {
        return new ScalarUnit(code(), space, binding());
    }

    @Override
    public ScalarUnit withCode(Code code) {
        return new ScalarUnit(code, space(), binding());
    }

    @Override
    protected Object[] basis() {
        return new Object[] {code(), space()};
    }

    @Override
    public String toString() {
        return "(" + code() + " @ " + space() + ")";
    }
}
