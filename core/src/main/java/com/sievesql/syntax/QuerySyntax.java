package com.sievesql.syntax;

import com.sievesql.mark.Mark;

import java.util.List;
import java.util.Objects;

/**
 * The whole query.
 */
public final class QuerySyntax extends Syntax {

    private final SegmentSyntax segment;

    public QuerySyntax(SegmentSyntax segment, Mark mark) {
        super(mark);
        this.segment = Objects.requireNonNull(segment, "segment must not be null");
    }

    public SegmentSyntax segment() {
        return segment;
    }

    @Override
    protected List<Object> basis() {
        return List.of(segment);
    }

    @Override
    public String toString() {
        return segment.toString();
    }
}
