package com.sievesql.frame;

import com.sievesql.functions.Arguments;
import com.sievesql.functions.Signature;
import com.sievesql.space.Expression;
import com.sievesql.types.Domain;

import java.util.Objects;

/**
 * An operation applied to phrase arguments.
 */
public final class FormulaPhrase extends Phrase {

    private final Signature signature;
    private final Arguments<Phrase> arguments;

    public FormulaPhrase(Signature signature, Domain domain, boolean isNullable, Arguments<Phrase> arguments,
                         Expression expression) {
        super(domain, isNullable, expression);
        this.signature = Objects.requireNonNull(signature, "signature must not be null");
        this.arguments = Objects.requireNonNull(arguments, "arguments must not be null");
    }

    public Signature signature() {
        return signature;
    }

    public Arguments<Phrase> arguments() {
        return arguments;
    }

    public Phrase get(String name) {
        return arguments.get(name);
    }

    public FormulaPhrase withArguments(Arguments<Phrase> arguments, boolean isNullable) {
        return new FormulaPhrase(signature, domain(), isNullable, arguments, expression());
    }

    @Override
    public Phrase withNullable(boolean isNullable) {
        return new FormulaPhrase(signature, domain(), isNullable, arguments, expression());
    }

    @Override
    protected Object[] basis() {
        return new Object[] {signature, arguments};
    }

    @Override
    public String toString() {
        return signature + arguments.toString();
    }
}
