package com.sievesql.compiler;

import com.sievesql.space.Space;
import com.sievesql.space.Unit;

import java.util.Map;

/**
 * A wrapper that always becomes its own subquery. Used where merging with
 * the parent would change the meaning, such as a {@code ROWNUM} read
 * after sorting.
 */
public final class PermanentTerm extends WrapperTerm {

    public PermanentTerm(int tag, Term kid, Space space, Space baseline, Map<Unit, Integer> routes) {
        super(tag, kid, space, baseline, routes);
    }

    @Override
    public String toString() {
        return "(!" + kid() + "!)";
    }
}
