package com.sievesql.space;

import com.sievesql.binding.QueryBinding;

/**
 * The encoded query: its segment, or null for a query with no output.
 */
public final class QueryExpr extends Expression {

    private final SegmentExpr segment;

    public QueryExpr(SegmentExpr segment, QueryBinding binding) {
        super(binding);
        this.segment = segment;
    }

    public SegmentExpr segment() {
        return segment;
    }

    @Override
    public QueryBinding binding() {
        return (QueryBinding) super.binding();
    }

    public QueryExpr withSegment(SegmentExpr segment) {
        return new QueryExpr(segment, binding());
    }

    @Override
    protected Object[] basis() {
        return new Object[] {segment};
    }
}
