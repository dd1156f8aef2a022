package com.sievesql.syntax;

import com.sievesql.mark.Mark;

/**
 * A numeric literal: an integer ({@code 60}), a decimal ({@code 2.5}) or an
 * exponential number ({@code 1e3}).
 */
public final class NumberSyntax extends LiteralSyntax {

    private final boolean isInteger;
    private final boolean isDecimal;
    private final boolean isExponential;

    public NumberSyntax(String value, Mark mark) {
        super(value, mark);
        this.isExponential = value.indexOf('e') >= 0 || value.indexOf('E') >= 0;
        this.isDecimal = !isExponential && value.indexOf('.') >= 0;
        this.isInteger = !isExponential && !isDecimal;
    }

    public boolean isInteger() {
        return isInteger;
    }

    public boolean isDecimal() {
        return isDecimal;
    }

    public boolean isExponential() {
        return isExponential;
    }

    @Override
    public String toString() {
        return value();
    }
}
