package com.sievesql.functions;

import com.sievesql.binding.Binding;
import com.sievesql.syntax.Syntax;

import java.util.Objects;

/**
 * A function that works on its unbound arguments: navigation and
 * definition forms such as {@code filter}, {@code select} or {@code define}.
 */
public final class MacroBinder extends FunctionBinder {

    /**
     * Produces the binding of a macro from its matched syntax arguments.
     */
    @FunctionalInterface
    public interface Expansion {
        Binding expand(FunctionCall call, Arguments<Syntax> arguments);
    }

    private final Expansion expansion;

    public MacroBinder(Signature signature, Expansion expansion) {
        super(signature);
        this.expansion = Objects.requireNonNull(expansion, "expansion must not be null");
    }

    @Override
    public Binding bind(FunctionCall call) {
        return expansion.expand(call, match(call));
    }

    @Override
    protected Binding correlate(FunctionCall call, Arguments<Binding> arguments) {
        throw new UnsupportedOperationException("macros are expanded, not correlated");
    }
}
