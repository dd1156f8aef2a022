package com.sievesql.compiler;

import com.sievesql.space.Code;
import com.sievesql.space.SegmentExpr;
import com.sievesql.space.Space;
import com.sievesql.space.Unit;

import java.util.List;
import java.util.Map;

/**
 * The top of an output segment: the rows to produce and the codes to
 * select from each of them.
 */
public final class SegmentTerm extends UnaryTerm {

    private final SegmentExpr segment;
    private final List<Code> superkeys;
    private final List<Code> keys;

    public SegmentTerm(int tag, Term kid, SegmentExpr segment, List<Code> superkeys, List<Code> keys,
                       Space space, Space baseline, Map<Unit, Integer> routes) {
        super(tag, kid, space, baseline, routes);
        this.segment = segment;
        this.superkeys = List.copyOf(superkeys);
        this.keys = List.copyOf(keys);
    }

    public SegmentExpr segment() {
        return segment;
    }

    /**
     * Returns the codes identifying a row of the enclosing segment.
     */
    public List<Code> superkeys() {
        return superkeys;
    }

    /**
     * Returns the codes identifying a row of this segment.
     */
    public List<Code> keys() {
        return keys;
    }

    @Override
    public String toString() {
        return kid() + " {}";
    }
}
