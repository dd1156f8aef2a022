package com.sievesql.functions;

import com.sievesql.binding.Binding;
import com.sievesql.binding.CastBinding;
import com.sievesql.types.Domain;
import com.sievesql.types.DomainCoercion;

import java.util.Objects;

/**
 * An explicit conversion such as {@code integer(x)} or {@code date(x)}.
 */
public final class CastBinder extends FunctionBinder {

    private final Domain domain;

    public CastBinder(Domain domain) {
        super(Signature.of(SignatureKind.CAST));
        Objects.requireNonNull(domain, "domain must not be null");
        this.domain = DomainCoercion.coerce(domain).orElse(domain);
    }

    public Domain domain() {
        return domain;
    }

    @Override
    protected Binding correlate(FunctionCall call, Arguments<Binding> arguments) {
        return new CastBinding(arguments.get("base"), domain, call.syntax());
    }
}
