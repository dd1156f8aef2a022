package com.sievesql.space;

import java.util.Objects;

/**
 * A reference from a correlated subquery to a code of the enclosing query.
 */
public final class CorrelationCode extends Code {

    private final Code code;

    public CorrelationCode(Code code) {
        super(code.domain(), code.binding());
        this.code = Objects.requireNonNull(code, "code must not be null");
    }

    public Code code() {
        return code;
    }

    @Override
    protected Object[] basis() {
        return new Object[] {code};
    }

    @Override
    public String toString() {
        return "^" + code;
    }
}
