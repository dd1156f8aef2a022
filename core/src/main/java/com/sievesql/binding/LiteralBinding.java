package com.sievesql.binding;

import com.sievesql.syntax.Syntax;
import com.sievesql.types.Domain;

/**
 * A constant. Untyped literals keep their source text as the value until
 * the encoder converts them to a concrete domain.
 */
public final class LiteralBinding extends Binding {

    private final Object value;

    public LiteralBinding(Binding base, Object value, Domain domain, Syntax syntax) {
        super(base, domain, syntax);
        this.value = value;
    }

    public Object value() {
        return value;
    }
}
