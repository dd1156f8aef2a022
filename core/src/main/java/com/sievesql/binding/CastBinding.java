package com.sievesql.binding;

import com.sievesql.syntax.Syntax;
import com.sievesql.types.Domain;

/**
 * An explicit conversion, such as {@code integer(x)}.
 */
public final class CastBinding extends Binding {

    public CastBinding(Binding base, Domain domain, Syntax syntax) {
        super(base, domain, syntax);
    }
}
