package com.sievesql.binding;

import com.sievesql.syntax.Syntax;
import com.sievesql.types.Domain;

/**
 * A conversion inserted by the binder to bring an operand to the domain a
 * function expects. Unlike {@link CastBinding} it keeps the name and the
 * title of the operand.
 */
public final class ImplicitCastBinding extends Binding {

    public ImplicitCastBinding(Binding base, Domain domain, Syntax syntax) {
        super(base, domain, syntax);
    }
}
