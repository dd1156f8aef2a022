package com.sievesql.functions;

import com.sievesql.binding.Binding;
import com.sievesql.binding.FormulaBinding;
import com.sievesql.binding.ImplicitCastBinding;
import com.sievesql.exception.BindError;
import com.sievesql.types.BooleanDomain;
import com.sievesql.types.DateDomain;
import com.sievesql.types.DateTimeDomain;
import com.sievesql.types.DecimalDomain;
import com.sievesql.types.Domain;
import com.sievesql.types.DomainCoercion;
import com.sievesql.types.EnumDomain;
import com.sievesql.types.FloatDomain;
import com.sievesql.types.IntegerDomain;
import com.sievesql.types.TextDomain;
import com.sievesql.types.TimeDomain;

import java.util.ArrayList;
import java.util.List;

/**
 * Correlators of the equality, comparison and logical operators.
 */
final class Predicates {

    private Predicates() {
        // Utility class
    }

    /**
     * {@code =} and {@code !=}: equality with one right operand, membership
     * with several.
     */
    static CustomFunctionBinder.Correlator among(int polarity) {
        return (call, arguments) -> {
            Binding lop = arguments.get("lop");
            List<Binding> rops = arguments.list("rops");
            List<Domain> domains = new ArrayList<>();
            domains.add(lop.domain());
            domains.addAll(FunctionBinder.domainsOf(rops));
            Domain domain = DomainCoercion.coerce(domains)
                .orElseThrow(() -> FunctionBinder.cannotCoerce(domains, call.mark()));
            Binding castLop = new ImplicitCastBinding(lop, domain, lop.syntax());
            List<Binding> castRops = new ArrayList<>();
            for (Binding rop : rops) {
                castRops.add(new ImplicitCastBinding(rop, domain, rop.syntax()));
            }
            if (castRops.size() == 1) {
                return new FormulaBinding(call.state().scope(), Signature.polar(SignatureKind.IS_EQUAL, polarity),
                        new BooleanDomain(), call.syntax(),
                        Arguments.<Binding>builder().put("lop", castLop).put("rop", castRops.get(0)).build());
            }
            return new FormulaBinding(call.state().scope(), Signature.polar(SignatureKind.IS_IN, polarity),
                    new BooleanDomain(), call.syntax(),
                    Arguments.<Binding>builder().put("lop", castLop).putList("rops", castRops).build());
        };
    }

    /**
     * {@code ==} and {@code !==}: equality that treats nulls as values.
     */
    static CustomFunctionBinder.Correlator totallyEqual(int polarity) {
        return (call, arguments) -> {
            Arguments<Binding> cast = coerceOperands(call, arguments);
            return new FormulaBinding(call.state().scope(),
                    Signature.polar(SignatureKind.IS_TOTALLY_EQUAL, polarity), new BooleanDomain(), call.syntax(),
                    cast);
        };
    }

    /**
     * {@code &} and {@code |}.
     */
    static CustomFunctionBinder.Correlator connective(SignatureKind kind) {
        return (call, arguments) -> {
            Binding lop = arguments.get("lop");
            Binding rop = arguments.get("rop");
            List<Binding> ops = List.of(
                new ImplicitCastBinding(lop, new BooleanDomain(), lop.syntax()),
                new ImplicitCastBinding(rop, new BooleanDomain(), rop.syntax()));
            return new FormulaBinding(call.state().scope(), Signature.of(kind), new BooleanDomain(), call.syntax(),
                    Arguments.<Binding>builder().putList("ops", ops).build());
        };
    }

    static Binding not(FunctionCall call, Arguments<Binding> arguments) {
        Binding op = arguments.get("op");
        Binding cast = new ImplicitCastBinding(op, new BooleanDomain(), op.syntax());
        return new FormulaBinding(call.state().scope(), Signature.of(SignatureKind.NOT), new BooleanDomain(),
                call.syntax(), Arguments.<Binding>builder().put("op", cast).build());
    }

    /**
     * {@code <}, {@code <=}, {@code >} and {@code >=}.
     */
    static CustomFunctionBinder.Correlator compare(String relation) {
        return (call, arguments) -> {
            Arguments<Binding> cast = coerceOperands(call, arguments);
            Domain domain = cast.get("lop").domain();
            if (!isComparable(domain)) {
                throw new BindError("values of type '" + domain.family() + "' are not comparable", call.mark());
            }
            return new FormulaBinding(call.state().scope(), Signature.compare(relation), new BooleanDomain(),
                    call.syntax(), cast);
        };
    }

    static boolean isComparable(Domain domain) {
        return domain instanceof IntegerDomain || domain instanceof DecimalDomain || domain instanceof FloatDomain
            || domain instanceof TextDomain || domain instanceof EnumDomain || domain instanceof DateDomain
            || domain instanceof TimeDomain || domain instanceof DateTimeDomain;
    }

    private static Arguments<Binding> coerceOperands(FunctionCall call, Arguments<Binding> arguments) {
        Binding lop = arguments.get("lop");
        Binding rop = arguments.get("rop");
        List<Domain> domains = List.of(lop.domain(), rop.domain());
        Domain domain = DomainCoercion.coerce(domains)
            .orElseThrow(() -> FunctionBinder.cannotCoerce(domains, call.mark()));
        return Arguments.<Binding>builder()
            .put("lop", new ImplicitCastBinding(lop, domain, lop.syntax()))
            .put("rop", new ImplicitCastBinding(rop, domain, rop.syntax()))
            .build();
    }
}
