package com.sievesql.space;

import com.sievesql.binding.Binding;

/**
 * One row per row of the base; the space of a nested home scope.
 */
public final class ScalarSpace extends Space {

    public ScalarSpace(Space base, Binding binding) {
        super(base, new ScalarFamily(), true, true, binding);
    }

    @Override
    public boolean isAxis() {
        return true;
    }

    @Override
    public Space withBase(Space base) {
        return new ScalarSpace(base, binding());
    }

    @Override
    protected Object[] basis() {
        return new Object[] {base()};
    }

    @Override
    public String toString() {
        return "(" + base() + " * I)";
    }
}
