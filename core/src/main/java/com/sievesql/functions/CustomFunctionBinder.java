package com.sievesql.functions;

import com.sievesql.binding.Binding;

import java.util.Objects;

/**
 * A function whose bound arguments are correlated by a dedicated rule,
 * such as equality, comparison or the logical connectives.
 */
public final class CustomFunctionBinder extends FunctionBinder {

    /**
     * Casts the bound arguments and builds the resulting binding.
     */
    @FunctionalInterface
    public interface Correlator {
        Binding correlate(FunctionCall call, Arguments<Binding> arguments);
    }

    private final Correlator correlator;

    public CustomFunctionBinder(Signature signature, Correlator correlator) {
        super(signature);
        this.correlator = Objects.requireNonNull(correlator, "correlator must not be null");
    }

    @Override
    protected Binding correlate(FunctionCall call, Arguments<Binding> arguments) {
        return correlator.correlate(call, arguments);
    }
}
