package com.sievesql.binding;

import com.sievesql.catalog.Join;
import com.sievesql.syntax.Syntax;

/**
 * Rows of a table reached from the base scope through a join.
 */
public final class AttachedTableBinding extends TableBinding {

    private final Join join;

    public AttachedTableBinding(Binding base, Join join, Syntax syntax) {
        super(base, join.target(), syntax);
        this.join = join;
    }

    public Join join() {
        return join;
    }
}
