package com.sievesql.compiler;

import com.sievesql.space.Space;
import com.sievesql.space.Unit;

import java.util.Map;

/**
 * A subquery evaluated once per row of an enclosing term.
 */
public final class CorrelationTerm extends UnaryTerm {

    public CorrelationTerm(int tag, Term kid, Space space, Space baseline, Map<Unit, Integer> routes) {
        super(tag, kid, space, baseline, routes);
    }

    @Override
    public String toString() {
        return "(" + kid() + ")";
    }
}
