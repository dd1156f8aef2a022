package com.sievesql.space;

import com.sievesql.binding.Binding;
import com.sievesql.types.Domain;

/**
 * A constant value; null stands for SQL {@code NULL}.
 */
public final class LiteralCode extends Code {

    private final Object value;

    public LiteralCode(Object value, Domain domain, Binding binding) {
        super(domain, binding);
        this.value = value;
    }

    public Object value() {
        return value;
    }

    public LiteralCode withValue(Object value, Domain domain) {
        return new LiteralCode(value, domain, binding());
    }

    @Override
    protected Object[] basis() {
        return new Object[] {value, domain()};
    }

    @Override
    public String toString() {
        return value instanceof String text ? "'" + text + "'" : String.valueOf(value);
    }
}
