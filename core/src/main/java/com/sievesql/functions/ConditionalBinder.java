package com.sievesql.functions;

import com.sievesql.binding.Binding;
import com.sievesql.binding.FormulaBinding;
import com.sievesql.binding.ImplicitCastBinding;
import com.sievesql.exception.BindError;
import com.sievesql.mark.Mark;
import com.sievesql.syntax.Syntax;
import com.sievesql.types.BooleanDomain;
import com.sievesql.types.Domain;
import com.sievesql.types.DomainCoercion;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code if(p1, c1, p2, c2, ..., alternative)} and
 * {@code switch(x, v1, c1, v2, c2, ..., alternative)}.
 *
 * <p>Arguments are taken in pairs; an odd trailing argument is the
 * alternative.
 */
public final class ConditionalBinder extends FunctionBinder {

    private final boolean isSwitch;

    private ConditionalBinder(SignatureKind kind) {
        super(Signature.of(kind));
        this.isSwitch = kind == SignatureKind.SWITCH;
    }

    public static ConditionalBinder ifThen() {
        return new ConditionalBinder(SignatureKind.IF);
    }

    public static ConditionalBinder switchCase() {
        return new ConditionalBinder(SignatureKind.SWITCH);
    }

    @Override
    protected Arguments<Syntax> match(FunctionCall call) {
        List<Syntax> operands = new ArrayList<>(call.operands());
        int minArgs = isSwitch ? 3 : 2;
        if (operands.size() < minArgs) {
            throw new BindError("function '" + call.name() + "' expects " + minArgs + " or more arguments; got "
                    + operands.size(), call.mark());
        }
        Arguments.Builder<Syntax> builder = Arguments.builder();
        if (isSwitch) {
            builder.put("variable", operands.remove(0));
        }
        List<Syntax> tests = new ArrayList<>();
        List<Syntax> consequents = new ArrayList<>();
        Syntax alternative = null;
        while (!operands.isEmpty()) {
            if (operands.size() == 1) {
                alternative = operands.remove(0);
            } else {
                tests.add(operands.remove(0));
                consequents.add(operands.remove(0));
            }
        }
        builder.putList(isSwitch ? "variants" : "predicates", tests);
        builder.putList("consequents", consequents);
        builder.put("alternative", alternative);
        return builder.build();
    }

    @Override
    protected Binding correlate(FunctionCall call, Arguments<Binding> arguments) {
        Arguments.Builder<Binding> builder = Arguments.builder();
        if (isSwitch) {
            Binding variable = arguments.get("variable");
            List<Binding> variants = arguments.list("variants");
            List<Domain> domains = new ArrayList<>();
            domains.add(variable.domain());
            domains.addAll(domainsOf(variants));
            Domain domain = DomainCoercion.coerce(domains).orElseThrow(() -> cannotCoerce(domains, call.mark()));
            builder.put("variable", new ImplicitCastBinding(variable, domain, variable.syntax()));
            builder.putList("variants", castAll(variants, domain));
        } else {
            builder.putList("predicates", castAll(arguments.list("predicates"), new BooleanDomain()));
        }
        List<Binding> consequents = arguments.list("consequents");
        Binding alternative = arguments.get("alternative");
        List<Domain> domains = domainsOf(consequents);
        if (alternative != null) {
            domains.add(alternative.domain());
        }
        Optional<Domain> common = DomainCoercion.coerce(domains);
        if (common.isEmpty()) {
            if (domains.size() > 1) {
                throw cannotCoerce(domains, call.mark());
            }
            Mark mark = !consequents.isEmpty() ? consequents.get(0).mark() : alternative.mark();
            throw new BindError("a scalar value is expected", mark);
        }
        Domain domain = common.get();
        builder.putList("consequents", castAll(consequents, domain));
        builder.put("alternative",
                alternative != null ? new ImplicitCastBinding(alternative, domain, alternative.syntax()) : null);
        return new FormulaBinding(call.state().scope(), signature(), domain, call.syntax(), builder.build());
    }

    private static List<Binding> castAll(List<Binding> bindings, Domain domain) {
        List<Binding> cast = new ArrayList<>();
        for (Binding binding : bindings) {
            cast.add(new ImplicitCastBinding(binding, domain, binding.syntax()));
        }
        return cast;
    }
}
