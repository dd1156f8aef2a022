package com.sievesql.frame;

import com.sievesql.space.Expression;
import com.sievesql.types.Domain;

/**
 * A correlated subquery used as a value; refers to an embedded frame by
 * tag.
 */
public final class EmbeddingPhrase extends Phrase {

    private final int tag;

    public EmbeddingPhrase(int tag, Domain domain, boolean isNullable, Expression expression) {
        super(domain, isNullable, expression);
        this.tag = tag;
    }

    public int tag() {
        return tag;
    }

    @Override
    public Phrase withNullable(boolean isNullable) {
        return new EmbeddingPhrase(tag, domain(), isNullable, expression());
    }

    @Override
    protected Object[] basis() {
        return new Object[] {tag};
    }

    @Override
    public String toString() {
        return "(" + tag + ")";
    }
}
