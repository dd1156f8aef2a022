package com.sievesql.frame;

import com.sievesql.space.Expression;
import com.sievesql.types.BooleanDomain;

/**
 * The Boolean constant {@code TRUE}, used where a clause must not be empty.
 */
public final class TruePhrase extends LiteralPhrase {

    public TruePhrase(Expression expression) {
        super(Boolean.TRUE, new BooleanDomain(), expression);
    }
}
