package com.sievesql.frame;

import com.sievesql.compiler.SegmentTerm;

import java.util.List;

/**
 * The top-level {@code SELECT} statement of a query.
 *
 * <p>{@link #outputIndexes()} has an entry for every output code of the
 * segment: the position of its phrase in the {@code SELECT} list, or
 * {@code -1} for a constant that is not sent to the database.
 */
public final class SegmentFrame extends BranchFrame {

    private final List<Integer> outputIndexes;

    public SegmentFrame(List<Anchor> include, List<NestedFrame> embed, List<Phrase> select, Phrase where,
                        List<Phrase> group, Phrase having, List<Phrase> order, Integer limit, Integer offset,
                        List<Integer> outputIndexes, int tag, SegmentTerm term) {
        super(include, embed, select, where, group, having, order, limit, offset, tag, term);
        this.outputIndexes = List.copyOf(outputIndexes);
    }

    public List<Integer> outputIndexes() {
        return outputIndexes;
    }

    @Override
    public SegmentTerm term() {
        return (SegmentTerm) super.term();
    }

    @Override
    public SegmentFrame with(List<Anchor> include, List<NestedFrame> embed, List<Phrase> select, Phrase where,
                             List<Phrase> group, Phrase having, List<Phrase> order, Integer limit, Integer offset) {
        return new SegmentFrame(include, embed, select, where, group, having, order, limit, offset,
                outputIndexes, tag(), term());
    }

    @Override
    protected Object[] basis() {
        return new Object[] {super.basis(), outputIndexes};
    }
}
