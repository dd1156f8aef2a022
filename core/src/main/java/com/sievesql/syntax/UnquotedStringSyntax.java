package com.sievesql.syntax;

import com.sievesql.mark.Mark;

/**
 * A bare label of a locator.
 */
public final class UnquotedStringSyntax extends StringSyntax {

    public UnquotedStringSyntax(String value, Mark mark) {
        super(value, mark);
    }

    @Override
    public String toString() {
        return escape(value());
    }
}
