package com.sievesql.syntax;

import com.sievesql.mark.Mark;

/**
 * A navigation {@code base.attribute}.
 */
public final class SpecifierSyntax extends OperatorSyntax {

    public SpecifierSyntax(Syntax lbranch, Syntax rbranch, Mark mark) {
        super(".", lbranch, rbranch, mark);
    }
}
