package com.sievesql.compiler;

import com.sievesql.space.Space;
import com.sievesql.space.Unit;

import java.util.List;
import java.util.Map;

/**
 * A term with one kid.
 */
public abstract class UnaryTerm extends Term {

    protected UnaryTerm(int tag, Term kid, Space space, Space baseline, Map<Unit, Integer> routes) {
        super(tag, List.of(kid), space, baseline, routes);
    }

    public Term kid() {
        return kids().get(0);
    }
}
