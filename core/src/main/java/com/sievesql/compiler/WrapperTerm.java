package com.sievesql.compiler;

import com.sievesql.space.Space;
import com.sievesql.space.Unit;

import java.util.Map;

/**
 * A term that only renames its kid: it adds routes but no operation.
 * The reducer may collapse it into its parent.
 */
public class WrapperTerm extends UnaryTerm {

    public WrapperTerm(int tag, Term kid, Space space, Space baseline, Map<Unit, Integer> routes) {
        super(tag, kid, space, baseline, routes);
    }

    @Override
    public String toString() {
        return "(" + kid() + ")";
    }
}
