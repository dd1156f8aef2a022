package com.sievesql.frame;

import com.sievesql.compiler.Term;

import java.util.List;

/**
 * A subquery.
 */
public final class NestedFrame extends BranchFrame {

    public NestedFrame(List<Anchor> include, List<NestedFrame> embed, List<Phrase> select, Phrase where,
                       List<Phrase> group, Phrase having, List<Phrase> order, Integer limit, Integer offset,
                       int tag, Term term) {
        super(include, embed, select, where, group, having, order, limit, offset, tag, term);
    }

    @Override
    public NestedFrame with(List<Anchor> include, List<NestedFrame> embed, List<Phrase> select, Phrase where,
                            List<Phrase> group, Phrase having, List<Phrase> order, Integer limit, Integer offset) {
        return new NestedFrame(include, embed, select, where, group, having, order, limit, offset, tag(), term());
    }
}
