package com.sievesql.syntax;

import com.sievesql.mark.Mark;

/**
 * A filter {@code flow ? condition}.
 */
public final class SieveSyntax extends OperatorSyntax {

    public SieveSyntax(Syntax lbranch, Syntax rbranch, Mark mark) {
        super("?", lbranch, rbranch, mark);
    }
}
