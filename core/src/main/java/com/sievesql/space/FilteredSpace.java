package com.sievesql.space;

import com.sievesql.binding.Binding;

import java.util.Objects;

/**
 * Rows of the base satisfying a Boolean code.
 */
public final class FilteredSpace extends Space {

    private final Code filter;

    public FilteredSpace(Space base, Code filter, Binding binding) {
        super(base, base.family(), true, false, binding);
        this.filter = Objects.requireNonNull(filter, "filter must not be null");
    }

    public Code filter() {
        return filter;
    }

    @Override
    public Space withBase(Space base) {
        return new FilteredSpace(base, filter, binding());
    }

    @Override
    protected Object[] basis() {
        return new Object[] {base(), filter};
    }

    @Override
    public String toString() {
        return "(" + base() + " ? " + filter + ")";
    }
}
