package com.sievesql.space;

import com.sievesql.binding.Binding;
import com.sievesql.catalog.Join;

/**
 * Rows of the target table attached to each base row through a join.
 */
public final class FiberTableSpace extends TableSpace {

    private final Join join;

    public FiberTableSpace(Space base, Join join, Binding binding) {
        super(base, join.target(), join.isContracting(), join.isExpanding(), binding);
        this.join = join;
    }

    public Join join() {
        return join;
    }

    @Override
    public Space withBase(Space base) {
        return new FiberTableSpace(base, join, binding());
    }

    @Override
    protected Object[] basis() {
        return new Object[] {base(), join};
    }

    @Override
    public String toString() {
        return "(" + base() + " . " + table() + ")";
    }
}
