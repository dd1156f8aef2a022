package com.sievesql.functions;

import com.sievesql.binding.Binding;
import com.sievesql.binding.FormulaBinding;
import com.sievesql.binding.ImplicitCastBinding;
import com.sievesql.types.Domain;
import com.sievesql.types.DomainCoercion;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A function with fixed argument and result domains, e.g. {@code date(y, m, d)}.
 */
public final class MonoFunctionBinder extends FunctionBinder {

    private final List<Domain> domains;
    private final Domain codomain;

    public MonoFunctionBinder(Signature signature, List<Domain> domains, Domain codomain) {
        super(signature);
        if (domains.size() != signature.slots().size()) {
            throw new IllegalArgumentException("expected " + signature.slots().size() + " domains for " + signature);
        }
        this.domains = List.copyOf(domains);
        this.codomain = Objects.requireNonNull(codomain, "codomain must not be null");
    }

    @Override
    protected Binding correlate(FunctionCall call, Arguments<Binding> arguments) {
        Arguments.Builder<Binding> cast = Arguments.builder();
        List<Slot> slots = signature().slots();
        for (int index = 0; index < slots.size(); index++) {
            Slot slot = slots.get(index);
            Domain domain = domains.get(index);
            if (slot.isSingular()) {
                Binding value = arguments.get(slot.name());
                cast.put(slot.name(), value != null ? new ImplicitCastBinding(value, domain, value.syntax()) : null);
            } else {
                List<Binding> values = new ArrayList<>();
                for (Binding item : arguments.list(slot.name())) {
                    values.add(new ImplicitCastBinding(item, domain, item.syntax()));
                }
                cast.putList(slot.name(), values);
            }
        }
        Domain result = DomainCoercion.coerce(codomain).orElse(codomain);
        return new FormulaBinding(call.state().scope(), signature(), result, call.syntax(), cast.build());
    }
}
