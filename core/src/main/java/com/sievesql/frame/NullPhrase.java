package com.sievesql.frame;

import com.sievesql.space.Expression;
import com.sievesql.types.Domain;

public final class NullPhrase extends LiteralPhrase {

    public NullPhrase(Domain domain, Expression expression) {
        super(null, domain, expression);
    }
}
