package com.sievesql.compiler;

import com.sievesql.space.Code;
import com.sievesql.space.Space;
import com.sievesql.space.Unit;

import java.util.List;
import java.util.Map;

/**
 * A term with a correlated subquery embedded into its expressions. The
 * right kid is a {@link CorrelationTerm}; the correlations are the codes
 * of the left kid it refers to.
 */
public final class EmbeddingTerm extends BinaryTerm {

    private final List<Code> correlations;

    public EmbeddingTerm(int tag, Term lkid, Term rkid, List<Code> correlations,
                         Space space, Space baseline, Map<Unit, Integer> routes) {
        super(tag, lkid, rkid, space, baseline, routes);
        this.correlations = List.copyOf(correlations);
    }

    public List<Code> correlations() {
        return correlations;
    }

    @Override
    public String toString() {
        return "(" + lkid() + " // " + rkid() + ")";
    }
}
