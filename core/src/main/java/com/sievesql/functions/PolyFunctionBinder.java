package com.sievesql.functions;

import com.sievesql.binding.Binding;
import com.sievesql.binding.FormulaBinding;
import com.sievesql.binding.ImplicitCastBinding;
import com.sievesql.types.IntegerDomain;
import com.sievesql.types.UntypedDomain;

import java.util.Objects;
import java.util.Set;

/**
 * A function with several overloads chosen by the domains of its
 * arguments, e.g. {@code +} or {@code round}.
 *
 * <p>Slots listed as integer slots (lengths and positions of the string
 * functions) are cast to integer before the overload is chosen.
 */
public final class PolyFunctionBinder extends FunctionBinder {

    private final CorrelationTable correlations;
    private final Set<String> integerSlots;

    public PolyFunctionBinder(Signature signature, CorrelationTable correlations, Set<String> integerSlots) {
        super(signature);
        this.correlations = Objects.requireNonNull(correlations, "correlations must not be null");
        this.integerSlots = Set.copyOf(integerSlots);
    }

    public PolyFunctionBinder(Signature signature, CorrelationTable correlations) {
        this(signature, correlations, Set.of());
    }

    @Override
    protected Binding correlate(FunctionCall call, Arguments<Binding> arguments) {
        for (String name : integerSlots) {
            Binding value = arguments.get(name);
            if (value != null) {
                arguments = arguments.with(name, new ImplicitCastBinding(value, new IntegerDomain(), value.syntax()));
            }
        }
        FormulaBinding binding = new FormulaBinding(call.state().scope(), signature(), new UntypedDomain(),
                call.syntax(), arguments);
        return correlations.correlate(binding);
    }
}
