package com.sievesql.binding;

import com.sievesql.syntax.Syntax;
import com.sievesql.types.Domain;

/**
 * A binding that starts a new naming scope.
 */
public abstract class ScopingBinding extends Binding {

    protected ScopingBinding(Binding base, Domain domain, Syntax syntax) {
        super(base, domain, syntax);
    }
}
