package com.sievesql.binding;

import com.sievesql.syntax.Syntax;
import com.sievesql.types.Domain;

import java.util.Objects;

/**
 * A binding that modifies its base and delegates name lookup to it.
 */
public abstract class ChainingBinding extends Binding {

    protected ChainingBinding(Binding base, Domain domain, Syntax syntax) {
        super(Objects.requireNonNull(base, "base must not be null"), domain, syntax);
    }
}
