package com.sievesql.syntax;

import com.sievesql.mark.Mark;

/**
 * A projection {@code flow ^ kernel}.
 */
public final class QuotientSyntax extends OperatorSyntax {

    public QuotientSyntax(Syntax lbranch, Syntax rbranch, Mark mark) {
        super("^", lbranch, rbranch, mark);
    }
}
