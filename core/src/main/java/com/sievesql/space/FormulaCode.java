package com.sievesql.space;

import com.sievesql.binding.Binding;
import com.sievesql.functions.Arguments;
import com.sievesql.functions.Signature;
import com.sievesql.types.Domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An operation applied to code arguments.
 */
public final class FormulaCode extends Code {

    private final Signature signature;
    private final Arguments<Code> arguments;
    private List<Unit> units;

    public FormulaCode(Signature signature, Domain domain, Arguments<Code> arguments, Binding binding) {
        super(domain, binding);
        this.signature = Objects.requireNonNull(signature, "signature must not be null");
        this.arguments = Objects.requireNonNull(arguments, "arguments must not be null");
    }

    public Signature signature() {
        return signature;
    }

    public Arguments<Code> arguments() {
        return arguments;
    }

    /**
     * Shortcut for a singular argument.
     */
    public Code get(String name) {
        return arguments.get(name);
    }

    @Override
    public List<Unit> units() {
        if (units == null) {
            List<Unit> collected = new ArrayList<>();
            for (Code cell : arguments.cells()) {
                collected.addAll(cell.units());
            }
            units = List.copyOf(collected);
        }
        return units;
    }

    @Override
    protected Object[] basis() {
        return new Object[] {signature, domain(), arguments};
    }

    @Override
    public String toString() {
        return signature + arguments.toString();
    }
}
