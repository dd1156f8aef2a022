package com.sievesql.space;

import com.sievesql.binding.Binding;

/**
 * The single row every other space grows from.
 */
public final class RootSpace extends Space {

    public RootSpace(Binding binding) {
        super(null, new ScalarFamily(), false, false, binding);
    }

    @Override
    public boolean isAxis() {
        return true;
    }

    @Override
    public boolean isRoot() {
        return true;
    }

    @Override
    public Space withBase(Space base) {
        return this;
    }

    @Override
    protected Object[] basis() {
        return new Object[] {null};
    }

    @Override
    public String toString() {
        return "I";
    }
}
