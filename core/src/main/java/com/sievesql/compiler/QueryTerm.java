package com.sievesql.compiler;

import com.sievesql.mark.Mark;
import com.sievesql.mark.Marked;
import com.sievesql.space.QueryExpr;

import java.util.Objects;

/**
 * The root of a compiled query. The segment is null for a query with no
 * output.
 */
public final class QueryTerm implements Marked {

    private final SegmentTerm segment;
    private final QueryExpr expression;

    public QueryTerm(SegmentTerm segment, QueryExpr expression) {
        this.segment = segment;
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
    }

    public SegmentTerm segment() {
        return segment;
    }

    public QueryExpr expression() {
        return expression;
    }

    @Override
    public Mark mark() {
        return expression.mark();
    }

    @Override
    public String toString() {
        return segment != null ? segment.toString() : "{}";
    }
}
