package com.sievesql.syntax;

import com.sievesql.mark.Mark;

/**
 * A quoted string literal; the value is stored unquoted.
 */
public class StringSyntax extends LiteralSyntax {

    public StringSyntax(String value, Mark mark) {
        super(value, mark);
    }

    @Override
    public String toString() {
        return escape("'" + value().replace("'", "''") + "'");
    }
}
