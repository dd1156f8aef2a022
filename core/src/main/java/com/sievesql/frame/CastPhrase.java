package com.sievesql.frame;

import com.sievesql.space.Expression;
import com.sievesql.types.Domain;

import java.util.Objects;

/**
 * Conversion of a phrase to another domain.
 */
public final class CastPhrase extends Phrase {

    private final Phrase base;

    public CastPhrase(Phrase base, Domain domain, boolean isNullable, Expression expression) {
        super(domain, isNullable, expression);
        this.base = Objects.requireNonNull(base, "base must not be null");
    }

    public Phrase base() {
        return base;
    }

    public CastPhrase withBase(Phrase base) {
        return new CastPhrase(base, domain(), isNullable(), expression());
    }

    @Override
    public Phrase withNullable(boolean isNullable) {
        return new CastPhrase(base, domain(), isNullable, expression());
    }

    @Override
    protected Object[] basis() {
        return new Object[] {base};
    }

    @Override
    public String toString() {
        return base + "::" + domain();
    }
}
