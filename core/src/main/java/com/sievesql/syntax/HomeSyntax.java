package com.sievesql.syntax;

import com.sievesql.mark.Mark;

/**
 * A reference to the home scope {@code @name}.
 */
public final class HomeSyntax extends OperatorSyntax {

    public HomeSyntax(Syntax rbranch, Mark mark) {
        super("@", null, rbranch, mark);
    }
}
