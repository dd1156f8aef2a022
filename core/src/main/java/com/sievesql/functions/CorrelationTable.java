package com.sievesql.functions;

import com.sievesql.binding.Binding;
import com.sievesql.binding.FormulaBinding;
import com.sievesql.binding.ImplicitCastBinding;
import com.sievesql.exception.BindError;
import com.sievesql.syntax.OperatorSyntax;
import com.sievesql.syntax.ApplicationSyntax;
import com.sievesql.types.BooleanDomain;
import com.sievesql.types.DateDomain;
import com.sievesql.types.DateTimeDomain;
import com.sievesql.types.DecimalDomain;
import com.sievesql.types.Domain;
import com.sievesql.types.DomainCoercion;
import com.sievesql.types.FloatDomain;
import com.sievesql.types.IntegerDomain;
import com.sievesql.types.TextDomain;
import com.sievesql.types.TimeDomain;
import com.sievesql.types.UntypedDomain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Overloads of the polymorphic functions, keyed by signature kind and the
 * domains of the leading arguments.
 *
 * <p>A formula produced by a polymorphic binder has an untyped result;
 * {@link #correlate} picks the overload that applies and returns the typed
 * formula. When several overloads apply, one registered for a strict
 * subkind wins.
 */
public final class CorrelationTable {

    private static final Logger logger = LoggerFactory.getLogger(CorrelationTable.class);

    private static final Domain INT = new IntegerDomain();
    private static final Domain DEC = new DecimalDomain();
    private static final Domain FLOAT = new FloatDomain();
    private static final Domain TEXT = new TextDomain();
    private static final Domain UNTYPED = new UntypedDomain();
    private static final Domain DATE = new DateDomain();
    private static final Domain TIME = new TimeDomain();
    private static final Domain DATETIME = new DateTimeDomain();
    private static final Domain BOOL = new BooleanDomain();

    private final List<Correlation> correlations = new ArrayList<>();

    public static CorrelationTable builtins() {
        CorrelationTable table = new CorrelationTable();
        table.initializeArithmetic();
        table.initializeRounding();
        table.initializeStrings();
        table.initializeExtraction();
        table.initializeAggregates();
        return table;
    }

    public CorrelationTable add(Correlation correlation) {
        correlations.add(correlation);
        return this;
    }

    public List<Correlation> correlations() {
        return List.copyOf(correlations);
    }

    /**
     * Resolves the overload of an untyped formula.
     *
     * @param binding the formula as bound by a polymorphic binder
     * @return the formula with cast arguments and its result domain
     * @throws BindError if no overload accepts the argument domains
     */
    public Binding correlate(FormulaBinding binding) {
        SignatureKind key = binding.signature().kind();
        List<Domain> vector = dispatchVector(binding);
        List<Correlation> candidates = new ArrayList<>();
        for (Correlation correlation : correlations) {
            if (correlation.matches(key, vector)) {
                candidates.add(correlation);
            }
        }
        List<Correlation> best = new ArrayList<>();
        for (Correlation candidate : candidates) {
            boolean isDominated = false;
            for (Correlation other : candidates) {
                if (other != candidate && other.dominates(candidate)) {
                    isDominated = true;
                    break;
                }
            }
            if (!isDominated) {
                best.add(candidate);
            }
        }
        if (best.isEmpty()) {
            throw noOverload(binding, key, vector);
        }
        if (best.size() > 1) {
            throw ambiguous(binding, vector, best);
        }
        Correlation correlation = best.get(0);
        logger.trace("Correlated {} over {} to {}", key, vector, correlation.codomain());
        return apply(correlation, binding);
    }

    private static List<Domain> dispatchVector(FormulaBinding binding) {
        List<Domain> vector = new ArrayList<>();
        for (Slot slot : binding.signature().slots()) {
            if (!(slot.isMandatory() && slot.isSingular())) {
                break;
            }
            vector.add(binding.arguments().get(slot.name()).domain());
        }
        return vector;
    }

    private static Binding apply(Correlation correlation, FormulaBinding binding) {
        Signature signature = binding.signature();
        if (correlation.target() != null) {
            signature = signature.withKind(correlation.target());
        }
        Arguments<Binding> arguments = binding.arguments();
        List<Slot> slots = signature.slots();
        for (int index = 0; index < slots.size() && index < correlation.domains().size(); index++) {
            Slot slot = slots.get(index);
            Domain domain = coerce(correlation.domains().get(index));
            if (slot.isSingular()) {
                Binding value = arguments.get(slot.name());
                if (value != null) {
                    arguments = arguments.with(slot.name(), new ImplicitCastBinding(value, domain, value.syntax()));
                }
            } else {
                List<Binding> values = new ArrayList<>();
                for (Binding item : arguments.list(slot.name())) {
                    values.add(new ImplicitCastBinding(item, domain, item.syntax()));
                }
                arguments = arguments.with(slot.name(), values);
            }
        }
        return new FormulaBinding(binding.base(), signature, coerce(correlation.codomain()), binding.syntax(),
                arguments);
    }

    private static Domain coerce(Domain domain) {
        return DomainCoercion.coerce(domain).orElse(domain);
    }

    private static String describe(FormulaBinding binding) {
        if (binding.syntax() instanceof OperatorSyntax operator) {
            return "operator '" + operator.symbol() + "'";
        }
        if (binding.syntax() instanceof ApplicationSyntax application) {
            return "function '" + application.name() + "'";
        }
        return "'" + binding.syntax() + "'";
    }

    private static BindError ambiguous(FormulaBinding binding, List<Domain> vector, List<Correlation> best) {
        List<String> matches = new ArrayList<>();
        for (Correlation correlation : best) {
            String match = families(correlation.domains());
            if (!matches.contains(match)) {
                matches.add(match);
            }
        }
        return new BindError(describe(binding) + " is ambiguous for " + families(vector),
                binding.mark(), "matching types: " + String.join(", ", matches));
    }

    private BindError noOverload(FormulaBinding binding, SignatureKind key, List<Domain> vector) {
        String name = describe(binding);
        boolean isPlural = vector.size() > 1;
        String families = families(vector);
        List<String> validTypes = new ArrayList<>();
        for (Correlation correlation : correlations) {
            if (!key.isSubkindOf(correlation.kind())) {
                continue;
            }
            for (List<Domain> candidate : correlation.vectors()) {
                if (candidate.stream().anyMatch(domain -> domain instanceof UntypedDomain)) {
                    continue;
                }
                String valid = families(candidate);
                if (!validTypes.contains(valid)) {
                    validTypes.add(valid);
                }
            }
        }
        String hint = validTypes.isEmpty()
            ? null
            : "valid " + (isPlural ? "types" : "type") + ": " + String.join(", ", validTypes);
        return new BindError(name + " cannot be applied to " + (isPlural ? "values of types " : "a value of type ")
                + families, binding.mark(), hint);
    }

    private static String families(List<Domain> vector) {
        String families = vector.stream()
            .map(domain -> "'" + domain.family() + "'")
            .collect(Collectors.joining(", "));
        return vector.size() > 1 ? "(" + families + ")" : families;
    }

    // ==================== Builtin overloads ====================

    private void define(SignatureKind kind, List<List<Domain>> vectors, SignatureKind target,
                        List<Domain> domains, Domain codomain) {
        add(new Correlation(kind, vectors, target, domains, codomain));
    }

    private static List<Domain> v(Domain... domains) {
        return List.of(domains);
    }

    private void defineNumeric(SignatureKind kind) {
        define(kind, List.of(v(INT, INT)), null, v(INT, INT), INT);
        define(kind, List.of(v(INT, DEC), v(DEC, INT), v(DEC, DEC)), null, v(DEC, DEC), DEC);
        define(kind, List.of(v(INT, FLOAT), v(DEC, FLOAT), v(FLOAT, INT), v(FLOAT, DEC), v(FLOAT, FLOAT)),
                null, v(FLOAT, FLOAT), FLOAT);
    }

    private void initializeArithmetic() {
        defineNumeric(SignatureKind.ADD);
        define(SignatureKind.ADD, List.of(v(DATE, INT)), SignatureKind.DATE_INCREMENT, v(DATE, INT), DATE);
        define(SignatureKind.ADD, List.of(v(DATETIME, INT), v(DATETIME, DEC), v(DATETIME, FLOAT)),
                SignatureKind.DATETIME_INCREMENT, v(DATETIME, FLOAT), DATETIME);
        define(SignatureKind.ADD, List.of(v(UNTYPED, UNTYPED), v(UNTYPED, TEXT), v(TEXT, UNTYPED), v(TEXT, TEXT)),
                SignatureKind.CONCATENATE, v(TEXT, TEXT), TEXT);

        defineNumeric(SignatureKind.SUBTRACT);
        define(SignatureKind.SUBTRACT, List.of(v(DATE, INT)), SignatureKind.DATE_DECREMENT, v(DATE, INT), DATE);
        define(SignatureKind.SUBTRACT, List.of(v(DATETIME, INT), v(DATETIME, DEC), v(DATETIME, FLOAT)),
                SignatureKind.DATETIME_DECREMENT, v(DATETIME, FLOAT), DATETIME);
        define(SignatureKind.SUBTRACT, List.of(v(DATE, DATE)), SignatureKind.DATE_DIFFERENCE, v(DATE, DATE), INT);

        defineNumeric(SignatureKind.MULTIPLY);

        define(SignatureKind.DIVIDE, List.of(v(INT, INT), v(INT, DEC), v(DEC, INT), v(DEC, DEC)),
                null, v(DEC, DEC), DEC);
        define(SignatureKind.DIVIDE, List.of(v(INT, FLOAT), v(DEC, FLOAT), v(FLOAT, INT), v(FLOAT, DEC),
                v(FLOAT, FLOAT)), null, v(FLOAT, FLOAT), FLOAT);

        for (SignatureKind kind : List.of(SignatureKind.KEEP_POLARITY, SignatureKind.REVERSE_POLARITY)) {
            for (Domain domain : List.of(INT, DEC, FLOAT)) {
                define(kind, List.of(v(domain)), null, v(domain), domain);
            }
        }
    }

    private void initializeRounding() {
        for (SignatureKind kind : List.of(SignatureKind.ROUND, SignatureKind.TRUNC)) {
            define(kind, List.of(v(INT), v(DEC)), null, v(DEC), DEC);
            define(kind, List.of(v(FLOAT)), null, v(FLOAT), FLOAT);
        }
        for (SignatureKind kind : List.of(SignatureKind.ROUND_TO, SignatureKind.TRUNC_TO)) {
            define(kind, List.of(v(INT, INT), v(DEC, INT)), null, v(DEC, INT), DEC);
        }
    }

    private void initializeStrings() {
        define(SignatureKind.LENGTH, List.of(v(TEXT), v(UNTYPED)), null, v(TEXT), INT);
        define(SignatureKind.CONTAINS, List.of(v(TEXT, TEXT), v(TEXT, UNTYPED), v(UNTYPED, TEXT), v(UNTYPED, UNTYPED)),
                null, v(TEXT, TEXT), BOOL);
        for (SignatureKind kind : List.of(SignatureKind.HEAD, SignatureKind.TAIL, SignatureKind.SLICE,
                SignatureKind.AT, SignatureKind.UPPER, SignatureKind.LOWER, SignatureKind.TRIM)) {
            define(kind, List.of(v(UNTYPED), v(TEXT)), null, v(TEXT), TEXT);
        }
        define(SignatureKind.REPLACE, List.of(v(UNTYPED), v(TEXT)), null, v(TEXT, TEXT, TEXT), TEXT);
    }

    private void initializeExtraction() {
        for (SignatureKind kind : List.of(SignatureKind.EXTRACT_YEAR, SignatureKind.EXTRACT_MONTH,
                SignatureKind.EXTRACT_DAY)) {
            define(kind, List.of(v(DATE)), null, v(DATE), INT);
            define(kind, List.of(v(DATETIME)), null, v(DATETIME), INT);
        }
        for (SignatureKind kind : List.of(SignatureKind.EXTRACT_HOUR, SignatureKind.EXTRACT_MINUTE)) {
            define(kind, List.of(v(TIME)), null, v(TIME), INT);
            define(kind, List.of(v(DATETIME)), null, v(DATETIME), INT);
        }
        define(SignatureKind.EXTRACT_SECOND, List.of(v(TIME)), null, v(TIME), FLOAT);
        define(SignatureKind.EXTRACT_SECOND, List.of(v(DATETIME)), null, v(DATETIME), FLOAT);
    }

    private void initializeAggregates() {
        for (Domain domain : List.of(INT, DEC, FLOAT, TEXT, DATE, TIME, DATETIME)) {
            define(SignatureKind.MIN_MAX, List.of(v(domain)), null, v(domain), domain);
        }
        for (Domain domain : List.of(INT, DEC, FLOAT)) {
            define(SignatureKind.SUM, List.of(v(domain)), null, v(domain), domain);
        }
        define(SignatureKind.AVG, List.of(v(INT), v(DEC)), null, v(DEC), DEC);
        define(SignatureKind.AVG, List.of(v(FLOAT)), null, v(FLOAT), FLOAT);
    }
}
