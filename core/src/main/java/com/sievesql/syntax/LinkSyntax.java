package com.sievesql.syntax;

import com.sievesql.mark.Mark;

/**
 * A link {@code origin -> target}.
 */
public final class LinkSyntax extends OperatorSyntax {

    public LinkSyntax(Syntax lbranch, Syntax rbranch, Mark mark) {
        super("->", lbranch, rbranch, mark);
    }
}
