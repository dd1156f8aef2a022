package com.sievesql.compiler;

import com.sievesql.space.Code;
import com.sievesql.space.Space;
import com.sievesql.space.Unit;
import com.sievesql.types.BooleanDomain;

import java.util.Map;

/**
 * Rows of the kid satisfying a condition ({@code WHERE}).
 */
public final class FilterTerm extends UnaryTerm {

    private final Code filter;

    public FilterTerm(int tag, Term kid, Code filter, Space space, Space baseline, Map<Unit, Integer> routes) {
        super(tag, kid, space, baseline, routes);
        if (!(filter.domain() instanceof BooleanDomain)) {
            throw new IllegalArgumentException("filter must be Boolean: " + filter);
        }
        this.filter = filter;
    }

    public Code filter() {
        return filter;
    }

    @Override
    public String toString() {
        return "(" + kid() + " ? " + filter + ")";
    }
}
