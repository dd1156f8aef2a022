package com.sievesql.binding;

import com.sievesql.functions.Arguments;
import com.sievesql.functions.Signature;
import com.sievesql.syntax.Syntax;
import com.sievesql.types.Domain;

import java.util.Objects;

/**
 * A function or operator application.
 */
public final class FormulaBinding extends Binding {

    private final Signature signature;
    private final Arguments<Binding> arguments;

    public FormulaBinding(Binding base, Signature signature, Domain domain, Syntax syntax,
                          Arguments<Binding> arguments) {
        super(base, domain, syntax);
        this.signature = Objects.requireNonNull(signature, "signature must not be null");
        this.arguments = Objects.requireNonNull(arguments, "arguments must not be null");
    }

    public Signature signature() {
        return signature;
    }

    public Arguments<Binding> arguments() {
        return arguments;
    }
}
