package com.sievesql.functions;

import com.sievesql.binding.Binding;
import com.sievesql.binding.FormulaBinding;
import com.sievesql.binding.ImplicitCastBinding;
import com.sievesql.exception.BindError;
import com.sievesql.types.Domain;
import com.sievesql.types.DomainCoercion;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A function whose arguments are all coerced to one common domain, e.g.
 * {@code if_null(x, y)}. The result has the common domain unless a fixed
 * codomain is given.
 */
public final class HomoFunctionBinder extends FunctionBinder {

    private final Domain codomain;

    public HomoFunctionBinder(Signature signature, Domain codomain) {
        super(signature);
        this.codomain = codomain;
    }

    public HomoFunctionBinder(Signature signature) {
        this(signature, null);
    }

    @Override
    protected Binding correlate(FunctionCall call, Arguments<Binding> arguments) {
        List<Domain> domains = domainsOf(arguments.cells());
        Optional<Domain> common = DomainCoercion.coerce(domains);
        if (common.isEmpty()) {
            if (domains.size() > 1) {
                throw cannotCoerce(domains, call.mark());
            }
            throw new BindError("a scalar value is expected", call.mark());
        }
        Domain domain = common.get();
        Arguments<Binding> cast = arguments.map(value -> new ImplicitCastBinding(value, domain, value.syntax()));
        Domain result = codomain != null ? DomainCoercion.coerce(codomain).orElse(codomain) : domain;
        return new FormulaBinding(call.state().scope(), signature(), result, call.syntax(), cast);
    }
}
