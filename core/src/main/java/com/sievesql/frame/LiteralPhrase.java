package com.sievesql.frame;

import com.sievesql.space.Expression;
import com.sievesql.types.Domain;

/**
 * A constant; a null value is SQL {@code NULL}.
 */
public class LiteralPhrase extends Phrase {

    private final Object value;

    public LiteralPhrase(Object value, Domain domain, Expression expression) {
        super(domain, value == null, expression);
        this.value = value;
    }

    public Object value() {
        return value;
    }

    @Override
    public Phrase withNullable(boolean isNullable) {
        return this;
    }

    @Override
    protected Object[] basis() {
        return new Object[] {value};
    }

    @Override
    public String toString() {
        return value instanceof String text ? "'" + text + "'" : String.valueOf(value);
    }
}
