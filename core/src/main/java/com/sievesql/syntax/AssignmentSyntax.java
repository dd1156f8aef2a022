package com.sievesql.syntax;

import com.sievesql.mark.Mark;

/**
 * An assignment {@code name := value}, {@code name($p, ...) := value} or {@code base.name := value}.
 */
public final class AssignmentSyntax extends OperatorSyntax {

    public AssignmentSyntax(Syntax lbranch, Syntax rbranch, Mark mark) {
        super(":=", lbranch, rbranch, mark);
    }
}
