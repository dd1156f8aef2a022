package com.sievesql.syntax;

import com.sievesql.mark.Mark;

import java.util.List;

/**
 * A command applied to a segment: {@code /segment/:name(argument, ...)}.
 */
public final class CommandSyntax extends MappingSyntax {

    public CommandSyntax(IdentifierSyntax identifier, SegmentSyntax lbranch, List<Syntax> rbranches, Mark mark) {
        super(identifier, lbranch, rbranches, mark);
    }

    @Override
    public SegmentSyntax lbranch() {
        return (SegmentSyntax) super.lbranch();
    }

    @Override
    public String toString() {
        return lbranch() + "/:" + identifier() + renderArguments();
    }
}
