package com.sievesql.compiler;

import com.sievesql.space.ScalarFamily;
import com.sievesql.space.Space;
import com.sievesql.space.Unit;

import java.util.List;
import java.util.Map;

/**
 * A single row with no columns; assembles to a {@code SELECT} without
 * {@code FROM}, or from the dialect's dummy table.
 */
public final class ScalarTerm extends Term {

    public ScalarTerm(int tag, Space space, Space baseline, Map<Unit, Integer> routes) {
        super(tag, List.of(), space, baseline, routes);
        if (!(space.family() instanceof ScalarFamily)) {
            throw new IllegalArgumentException("scalar term requires a scalar space: " + space);
        }
    }

    @Override
    public String toString() {
        return "I";
    }
}
