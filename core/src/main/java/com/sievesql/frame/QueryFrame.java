package com.sievesql.frame;

import com.sievesql.compiler.QueryTerm;
import com.sievesql.mark.Mark;
import com.sievesql.mark.Marked;

import java.util.Objects;

/**
 * The root of the frame tree. The segment is null for a query with no
 * output.
 */
public final class QueryFrame implements Marked {

    private final SegmentFrame segment;
    private final QueryTerm term;

    public QueryFrame(SegmentFrame segment, QueryTerm term) {
        this.segment = segment;
        this.term = Objects.requireNonNull(term, "term must not be null");
    }

    public SegmentFrame segment() {
        return segment;
    }

    public QueryTerm term() {
        return term;
    }

    public QueryFrame withSegment(SegmentFrame segment) {
        return new QueryFrame(segment, term);
    }

    @Override
    public Mark mark() {
        return term.mark();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof QueryFrame other)) {
            return false;
        }
        return Objects.equals(segment, other.segment);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(segment);
    }

    @Override
    public String toString() {
        return segment != null ? segment.toString() : "{}";
    }
}
