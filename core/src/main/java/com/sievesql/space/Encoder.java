package com.sievesql.space;

import com.sievesql.binding.AttachedTableBinding;
import com.sievesql.binding.Binding;
import com.sievesql.binding.CastBinding;
import com.sievesql.binding.ChainingBinding;
import com.sievesql.binding.ColumnBinding;
import com.sievesql.binding.ComplementBinding;
import com.sievesql.binding.CoverBinding;
import com.sievesql.binding.FormulaBinding;
import com.sievesql.binding.FreeTableBinding;
import com.sievesql.binding.HomeBinding;
import com.sievesql.binding.IdentityBinding;
import com.sievesql.binding.ImplicitCastBinding;
import com.sievesql.binding.KernelBinding;
import com.sievesql.binding.LiteralBinding;
import com.sievesql.binding.LocatorBinding;
import com.sievesql.binding.Lookup;
import com.sievesql.binding.QueryBinding;
import com.sievesql.binding.QuotientBinding;
import com.sievesql.binding.RescopingBinding;
import com.sievesql.binding.RootBinding;
import com.sievesql.binding.SegmentBinding;
import com.sievesql.binding.SelectionBinding;
import com.sievesql.binding.SieveBinding;
import com.sievesql.binding.SortBinding;
import com.sievesql.exception.EncodeError;
import com.sievesql.functions.Arguments;
import com.sievesql.functions.Signature;
import com.sievesql.functions.SignatureKind;
import com.sievesql.types.BooleanDomain;
import com.sievesql.types.DateDomain;
import com.sievesql.types.DateTimeDomain;
import com.sievesql.types.DecimalDomain;
import com.sievesql.types.Domain;
import com.sievesql.types.DomainCoercion;
import com.sievesql.types.EntityDomain;
import com.sievesql.types.EnumDomain;
import com.sievesql.types.FloatDomain;
import com.sievesql.types.IdentityDomain;
import com.sievesql.types.IntegerDomain;
import com.sievesql.types.OpaqueDomain;
import com.sievesql.types.RecordDomain;
import com.sievesql.types.TextDomain;
import com.sievesql.types.TimeDomain;
import com.sievesql.types.UntypedDomain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Lowers a binding graph into spaces and codes.
 *
 * <p>Two operations drive the translation:
 * <ul>
 *   <li>{@link #relate(Binding)} maps a binding to the space of rows it
 *       ranges over;</li>
 *   <li>{@link #encode(Binding)} maps a scalar binding to a code.</li>
 * </ul>
 * Results are memoized per binding, and every node passes through an
 * {@link Arena} so that equal spaces share one instance.
 *
 * <p>An encoder instance translates one query and is not thread-safe.
 */
public final class Encoder {

    private static final Logger logger = LoggerFactory.getLogger(Encoder.class);

    private final Arena arena;
    private final Integer rowLimit;
    private final Map<Binding, Code> codes = new IdentityHashMap<>();
    private final Map<Binding, Space> spaces = new IdentityHashMap<>();

    /**
     * Creates an encoder.
     *
     * @param arena the arena interning the produced nodes
     * @param rowLimit the maximum number of rows of a plural output, or null
     */
    public Encoder(Arena arena, Integer rowLimit) {
        this.arena = Objects.requireNonNull(arena, "arena must not be null");
        if (rowLimit != null && rowLimit < 0) {
            throw new IllegalArgumentException("rowLimit must not be negative: " + rowLimit);
        }
        this.rowLimit = rowLimit;
    }

    public Encoder() {
        this(new Arena(), null);
    }

    public Arena arena() {
        return arena;
    }

    // ==================== Entry point ====================

    /**
     * Encodes a whole query.
     */
    public QueryExpr encode(QueryBinding binding) {
        SegmentExpr segment = null;
        if (binding.segment() != null) {
            segment = segment(binding.segment(), true);
        }
        logger.debug("Encoded query into {} nodes", arena.size());
        return new QueryExpr(segment, binding);
    }

    private SegmentExpr segment(SegmentBinding binding, boolean isTop) {
        Space root = relate(binding.base());
        Binding seed = binding.seed();
        Code code = null;
        List<Code> segmentCodes;
        List<Unit> units = null;
        Space space = null;
        if (DomainCoercion.coerce(seed.domain()).isPresent()) {
            code = encode(seed);
            units = code.units();
            segmentCodes = List.of(code);
        } else if (seed.domain() instanceof RecordDomain || seed.domain() instanceof IdentityDomain) {
            segmentCodes = unpack(seed);
            space = relate(seed);
        } else {
            segmentCodes = unpack(seed);
            units = new ArrayList<>();
            for (Code item : segmentCodes) {
                units.addAll(item.units());
            }
        }
        if (space == null) {
            space = units.isEmpty() ? intern(new RootSpace(binding)) : dominant(units, binding,
                    "cannot deduce an unambiguous segment flow");
        }
        if (!space.spans(root)) {
            throw new EncodeError("expected a descendant segment flow", binding.mark());
        }
        if (code != null && !space.isRoot()) {
            if (code instanceof LiteralCode literal && literal.domain() instanceof UntypedDomain) {
                if (literal.value() == null) {
                    space = intern(new FilteredSpace(space, Codes.bool(false, binding), binding));
                }
            } else {
                space = intern(new FilteredSpace(space, intern(Codes.isNotNull(code, binding)), binding));
            }
        }
        if (isTop && rowLimit != null && !root.spans(space)) {
            space = limitRows(space, binding);
        }
        return new SegmentExpr(root, space, segmentCodes, binding);
    }

    private Space limitRows(Space space, Binding binding) {
        if (space instanceof OrderedSpace ordered) {
            if (ordered.limit() != null && ordered.limit() <= rowLimit) {
                return space;
            }
            return intern(new OrderedSpace(ordered.base(), ordered.order(), rowLimit, ordered.offset(),
                    ordered.binding()));
        }
        return intern(new OrderedSpace(space, List.of(), rowLimit, null, binding));
    }

    /**
     * Picks the space that dominates the spaces of all units.
     */
    private Space dominant(List<Unit> units, Binding binding, String ambiguity) {
        List<Space> candidates = new ArrayList<>();
        for (Unit unit : units) {
            if (candidates.stream().anyMatch(candidate -> candidate.dominates(unit.space()))) {
                continue;
            }
            candidates.removeIf(candidate -> unit.space().dominates(candidate));
            candidates.add(unit.space());
        }
        if (candidates.size() > 1) {
            throw new EncodeError(ambiguity, binding.mark());
        }
        return candidates.get(0);
    }

    // ==================== Unpacking ====================

    /**
     * Returns the codes of an output row: an indicator followed by the
     * element codes for records, the code itself for scalars.
     */
    private List<Code> unpack(Binding binding) {
        if (binding instanceof SelectionBinding selection) {
            return unpackSelection(selection);
        }
        if (binding instanceof IdentityBinding identity) {
            return unpackIdentity(identity);
        }
        if (binding instanceof SegmentBinding) {
            throw new EncodeError("nested segments are not supported", binding.mark());
        }
        return List.of(encode(binding));
    }

    private List<Code> unpackSelection(SelectionBinding binding) {
        List<Code> result = new ArrayList<>();
        Space space = relate(binding);
        result.add(intern(new ScalarUnit(Codes.bool(true, binding), space, binding)));
        for (Binding element : binding.elements()) {
            result.addAll(unpack(element));
        }
        return result;
    }

    private List<Code> unpackIdentity(IdentityBinding binding) {
        List<Code> result = new ArrayList<>();
        List<Code> indicators = new ArrayList<>();
        Space space = relate(binding);
        ScalarUnit trueIndicator = intern(new ScalarUnit(Codes.bool(true, binding), space, binding));
        indicators.add(trueIndicator);
        for (Binding element : binding.elements()) {
            List<Code> elementCodes = unpack(element);
            for (Code code : elementCodes) {
                if (code instanceof ScalarUnit unit && unit.space().dominates(space) && Codes.isTrue(unit.code())) {
                    code = trueIndicator;
                } else if (!space.isInflated() && code instanceof ColumnUnit unit
                        && unit.space().dominates(space) && !unit.space().equals(space)) {
                    code = intern(unit.withSpace(unit.space().inflate()));
                }
                result.add(code);
            }
            if (elementCodes.isEmpty()) {
                continue;
            }
            Code indicator = elementCodes.get(0);
            if (indicator instanceof ScalarUnit unit && unit.space().conforms(space) && Codes.isTrue(unit.code())) {
                continue;
            }
            if (indicator instanceof ColumnUnit unit && unit.space().conforms(space)
                    && !unit.column().isNullable()) {
                continue;
            }
            if (!(indicator instanceof FormulaCode formula
                    && formula.signature().equals(Signature.polar(SignatureKind.IS_NULL, -1)))) {
                indicator = intern(Codes.isNotNull(indicator, indicator.binding()));
            }
            indicators.add(indicator);
        }
        result.add(0, intern(Codes.and(indicators, binding)));
        return result;
    }

    // ==================== Relate ====================

    /**
     * Returns the space of rows the binding ranges over.
     */
    public Space relate(Binding binding) {
        Space space = spaces.get(binding);
        if (space == null) {
            space = intern(relateBinding(binding));
            spaces.put(binding, space);
        }
        return space;
    }

    private Space relateBinding(Binding binding) {
        if (binding instanceof RootBinding) {
            return new RootSpace(binding);
        }
        if (binding instanceof HomeBinding) {
            return new ScalarSpace(relate(binding.base()), binding);
        }
        if (binding instanceof FreeTableBinding table) {
            Space base = relate(binding.base());
            if (!(base.family() instanceof ScalarFamily)) {
                throw new EncodeError("expected a scalar scope for table '" + table.table().name() + "'",
                        binding.mark());
            }
            return new DirectTableSpace(base, table.table(), binding);
        }
        if (binding instanceof AttachedTableBinding attached) {
            return new FiberTableSpace(relate(binding.base()), attached.join(), binding);
        }
        if (binding instanceof ColumnBinding column) {
            return column.link() != null ? relate(column.link()) : relate(binding.base());
        }
        if (binding instanceof QuotientBinding quotient) {
            return relateQuotient(quotient);
        }
        if (binding instanceof ComplementBinding) {
            Space base = relate(binding.base());
            if (!(base.family() instanceof QuotientFamily)) {
                throw new EncodeError("expected a quotient scope", binding.mark());
            }
            return new ComplementSpace(base, binding);
        }
        if (binding instanceof CoverBinding cover) {
            return new MonikerSpace(relate(binding.base()), relate(cover.seed()), binding);
        }
        if (binding instanceof LocatorBinding locator) {
            return relateLocator(locator);
        }
        if (binding instanceof SieveBinding sieve) {
            return new FilteredSpace(relate(binding.base()), encode(sieve.filter()), binding);
        }
        if (binding instanceof SortBinding sort) {
            List<Order> order = new ArrayList<>();
            for (Binding item : sort.order()) {
                Integer direction = Lookup.direct(item);
                order.add(new Order(encode(item), direction != null ? direction : 1));
            }
            return new OrderedSpace(relate(binding.base()), order, sort.limit(), sort.offset(), binding);
        }
        if (binding.base() == null) {
            throw new EncodeError("expected a scope", binding.mark());
        }
        return relate(binding.base());
    }

    private Space relateQuotient(QuotientBinding binding) {
        Space base = relate(binding.base());
        Space seed = relate(binding.seed());
        if (base.spans(seed)) {
            throw new EncodeError("expected a plural expression", binding.seed().mark());
        }
        if (!seed.spans(base)) {
            throw new EncodeError("expected a descendant expression", binding.seed().mark());
        }
        List<Code> kernels = new ArrayList<>();
        for (Binding kernel : binding.kernels()) {
            kernels.add(encode(kernel));
        }
        return new QuotientSpace(base, seed, kernels, binding);
    }

    private Space relateLocator(LocatorBinding binding) {
        Space base = relate(binding.base());
        Space seed = relate(binding.seed());
        if (!seed.spans(base)) {
            throw new EncodeError("expected a descendant expression", binding.seed().mark());
        }
        List<Binding> labels = new ArrayList<>();
        flattenIdentity(binding.identity().elements(), labels);
        List<Binding> values = new ArrayList<>();
        flattenValue(binding.value(), values);
        if (labels.size() != values.size()) {
            throw new EncodeError("ill-formed locator", binding.mark());
        }
        List<Code> conditions = new ArrayList<>();
        for (int i = 0; i < labels.size(); i++) {
            conditions.add(intern(Codes.isEqual(encode(labels.get(i)), encode(values.get(i)), binding)));
        }
        return new LocatorSpace(base, seed, intern(Codes.and(conditions, binding)), binding);
    }

    private static void flattenIdentity(List<Binding> elements, List<Binding> labels) {
        for (Binding element : elements) {
            if (element instanceof IdentityBinding nested) {
                flattenIdentity(nested.elements(), labels);
            } else {
                labels.add(element);
            }
        }
    }

    private static void flattenValue(List<?> items, List<Binding> values) {
        for (Object item : items) {
            if (item instanceof List<?> nested) {
                flattenValue(nested, values);
            } else {
                values.add((Binding) item);
            }
        }
    }

    // ==================== Encode ====================

    /**
     * Returns the code of a scalar binding.
     */
    public Code encode(Binding binding) {
        Code code = codes.get(binding);
        if (code == null) {
            code = intern(encodeBinding(binding));
            codes.put(binding, code);
        }
        return code;
    }

    private Code encodeBinding(Binding binding) {
        if (binding instanceof ColumnBinding column) {
            return new ColumnUnit(column.column(), relate(binding.base()), binding);
        }
        if (binding instanceof KernelBinding kernel) {
            Space space = relate(binding.base());
            if (!(space.family() instanceof QuotientFamily family)) {
                throw new EncodeError("expected a quotient scope", binding.mark());
            }
            return new KernelUnit(family.kernels().get(kernel.index()), space, binding);
        }
        if (binding instanceof LiteralBinding literal) {
            return new LiteralCode(literal.value(), literal.domain(), binding);
        }
        if (binding instanceof CastBinding || binding instanceof ImplicitCastBinding) {
            return convert(binding.base(), binding.domain(), binding);
        }
        if (binding instanceof RescopingBinding rescoping) {
            return new ScalarUnit(encode(binding.base()), relate(rescoping.scope()), binding);
        }
        if (binding instanceof FormulaBinding formula) {
            return encodeFormula(formula);
        }
        if (binding instanceof ChainingBinding && !(binding instanceof SelectionBinding)) {
            return encode(binding.base());
        }
        throw new EncodeError("expected a code expression", binding.mark());
    }

    // ==================== Conversions ====================

    /**
     * Converts the code of {@code base} to {@code domain}.
     */
    private Code convert(Binding base, Domain domain, Binding binding) {
        Domain origin = base.domain();
        if (origin instanceof UntypedDomain && !(domain instanceof UntypedDomain)) {
            return convertUntyped(encode(base), domain, binding);
        }
        if (origin.getClass() == domain.getClass()) {
            return encode(base);
        }
        if (domain instanceof BooleanDomain) {
            if (origin instanceof EntityDomain || origin instanceof RecordDomain) {
                ScalarUnit unit = intern(new ScalarUnit(Codes.bool(true, binding), relate(base), binding));
                return Codes.isNotNull(unit, binding);
            }
            if (origin instanceof TextDomain) {
                Code code = encode(base);
                Code empty = new LiteralCode("", origin, binding);
                Code nullIf = Codes.binary(Signature.of(SignatureKind.NULL_IF), origin, code, empty, binding);
                return Codes.isNotNull(nullIf, binding);
            }
            if (isScalar(origin)) {
                return Codes.isNotNull(encode(base), binding);
            }
        }
        if (domain instanceof TextDomain && (origin instanceof BooleanDomain || isScalar(origin))) {
            return new CastCode(encode(base), domain, binding);
        }
        if (domain instanceof IntegerDomain
                && (origin instanceof DecimalDomain || origin instanceof FloatDomain || origin instanceof TextDomain)) {
            return new CastCode(encode(base), domain, binding);
        }
        if (domain instanceof DecimalDomain
                && (origin instanceof IntegerDomain || origin instanceof FloatDomain || origin instanceof TextDomain)) {
            Code code = encode(base);
            if (code instanceof LiteralCode literal && literal.domain() instanceof IntegerDomain) {
                Object value = literal.value() == null ? null : new BigDecimal((BigInteger) literal.value());
                return literal.withValue(value, domain);
            }
            return new CastCode(code, domain, binding);
        }
        if (domain instanceof FloatDomain
                && (origin instanceof IntegerDomain || origin instanceof DecimalDomain || origin instanceof TextDomain)) {
            Code code = encode(base);
            if (code instanceof LiteralCode literal
                    && (literal.domain() instanceof IntegerDomain || literal.domain() instanceof DecimalDomain)) {
                Object value = literal.value() == null ? null : ((Number) literal.value()).doubleValue();
                return literal.withValue(value, domain);
            }
            return new CastCode(code, domain, binding);
        }
        if ((domain instanceof DateDomain || domain instanceof TimeDomain)
                && (origin instanceof TextDomain || origin instanceof DateTimeDomain)) {
            return new CastCode(encode(base), domain, binding);
        }
        if (domain instanceof DateTimeDomain && (origin instanceof TextDomain || origin instanceof DateDomain)) {
            return new CastCode(encode(base), domain, binding);
        }
        throw new EncodeError("cannot convert a value of type " + origin + " to " + domain, binding.mark());
    }

    private static boolean isScalar(Domain domain) {
        return domain instanceof IntegerDomain || domain instanceof DecimalDomain || domain instanceof FloatDomain
                || domain instanceof EnumDomain || domain instanceof DateDomain || domain instanceof TimeDomain
                || domain instanceof DateTimeDomain || domain instanceof OpaqueDomain;
    }

    private Code convertUntyped(Code base, Domain domain, Binding binding) {
        List<ScalarUnit> wrappers = new ArrayList<>();
        Code code = base;
        while (code instanceof ScalarUnit unit) {
            wrappers.add(unit);
            code = unit.code();
        }
        if (!(code instanceof LiteralCode literal)) {
            throw new EncodeError("cannot convert a value of type " + base.domain() + " to " + domain,
                    binding.mark());
        }
        Object value;
        try {
            value = domain.parse((String) literal.value());
        } catch (IllegalArgumentException exc) {
            throw new EncodeError(exc.getMessage(), binding.mark(), exc);
        }
        Code result = new LiteralCode(value, domain, binding);
        for (int i = wrappers.size() - 1; i >= 0; i--) {
            result = intern(wrappers.get(i).withCode(result));
        }
        return result;
    }

    // ==================== Formulas ====================

    private Code encodeFormula(FormulaBinding binding) {
        SignatureKind kind = binding.signature().kind();
        switch (kind) {
            case LENGTH:
                return encodeLength(binding);
            case CONTAINS:
                return encodeContains(binding);
            case HEAD:
                return encodeHead(binding);
            case TAIL:
                return encodeTail(binding);
            case SLICE:
                return encodeSlice(binding);
            case AT:
                return encodeAt(binding);
            case REPLACE:
                return encodeReplace(binding);
            case COUNT:
                return encodeCount(binding);
            case AGGREGATE:
                return encodeAggregate(binding);
            case QUANTIFY:
                return encodeQuantify(binding);
            default:
                Arguments<Code> arguments = binding.arguments().map(this::encode);
                return new FormulaCode(binding.signature(), binding.domain(), arguments, binding);
        }
    }

    private Code operand(FormulaBinding binding, String name) {
        Binding argument = binding.arguments().get(name);
        return argument != null ? encode(argument) : null;
    }

    private Code substring(FormulaBinding binding, Code op, Code start, Code length) {
        return new FormulaCode(Signature.of(SignatureKind.SUBSTRING), binding.domain(),
                Arguments.<Code>builder().put("op", op).put("start", start).put("length", length).build(),
                binding);
    }

    private Code length(Code op, Binding binding) {
        return Codes.unary(Signature.of(SignatureKind.LENGTH), new IntegerDomain(), op, binding);
    }

    private Code encodeLength(FormulaBinding binding) {
        Code code = Codes.unary(binding.signature(), binding.domain(), operand(binding, "op"), binding);
        return Codes.ifNull(code, new LiteralCode(BigInteger.ZERO, binding.domain(), binding), binding);
    }

    private Code encodeContains(FormulaBinding binding) {
        Code lop = operand(binding, "lop");
        Code rop = operand(binding, "rop");
        if (rop instanceof LiteralCode literal) {
            if (literal.value() != null) {
                String pattern = ((String) literal.value())
                        .replace("\\", "\\\\")
                        .replace("%", "\\%")
                        .replace("_", "\\_");
                rop = literal.withValue("%" + pattern + "%", literal.domain());
            }
        } else {
            Domain domain = rop.domain();
            Code percent = new LiteralCode("%", domain, binding);
            rop = replace(rop, "\\", "\\\\", binding);
            rop = replace(rop, "%", "\\%", binding);
            rop = replace(rop, "_", "\\_", binding);
            rop = Codes.binary(Signature.of(SignatureKind.CONCATENATE), domain, percent, rop, binding);
            rop = Codes.binary(Signature.of(SignatureKind.CONCATENATE), domain, rop, percent, binding);
        }
        return Codes.binary(binding.signature().withKind(SignatureKind.LIKE), binding.domain(), lop, rop, binding);
    }

    private Code replace(Code op, String old, String replacement, Binding binding) {
        return new FormulaCode(Signature.of(SignatureKind.REPLACE), op.domain(),
                Arguments.<Code>builder()
                    .put("op", op)
                    .put("old", new LiteralCode(old, op.domain(), binding))
                    .put("new", new LiteralCode(replacement, op.domain(), binding))
                    .build(), binding);
    }

    private Code encodeHead(FormulaBinding binding) {
        Code op = operand(binding, "op");
        Code zero = Codes.integer(0, binding);
        Code one = Codes.integer(1, binding);
        Code length = operand(binding, "length");
        if (length == null) {
            length = one;
        }
        if (length instanceof LiteralCode literal) {
            if (literal.value() == null) {
                length = one;
            }
            BigInteger value = Codes.integerValue(length);
            if (value != null && value.signum() >= 0) {
                return substring(binding, op, one, length);
            }
        }
        length = Codes.ifNull(length, one, binding);
        Code negative = Codes.add(length(op, binding), length, binding);
        Code ifPositive = Codes.compare(">=", length, zero, binding);
        Code ifNegative = Codes.compare(">=", negative, zero, binding);
        length = conditional(List.of(ifPositive, ifNegative), List.of(length, negative), zero, binding);
        return substring(binding, op, one, length);
    }

    private Code encodeTail(FormulaBinding binding) {
        Code op = operand(binding, "op");
        Code zero = Codes.integer(0, binding);
        Code one = Codes.integer(1, binding);
        Code length = operand(binding, "length");
        if (length == null) {
            length = one;
        }
        if (length instanceof LiteralCode literal) {
            if (literal.value() == null) {
                length = one;
            }
            BigInteger value = Codes.integerValue(length);
            if (value != null && value.signum() < 0) {
                return substring(binding, op, Codes.literal(BigInteger.ONE.subtract(value), length.domain(), binding),
                        null);
            }
        }
        length = Codes.ifNull(length, one, binding);
        Code opLength = length(op, binding);
        Code start = Codes.subtract(one, length, binding);
        Code positiveStart = Codes.add(opLength, start, binding);
        Code ifNegative = Codes.compare("<", length, zero, binding);
        Code ifPositive = Codes.compare("<=", length, opLength, binding);
        start = conditional(List.of(ifNegative, ifPositive), List.of(start, positiveStart), one, binding);
        return substring(binding, op, start, null);
    }

    private Code encodeSlice(FormulaBinding binding) {
        Code op = operand(binding, "op");
        Code opLength = length(op, binding);
        Code zero = Codes.integer(0, binding);
        Code one = Codes.integer(1, binding);
        Code left = operand(binding, "left");
        Code right = operand(binding, "right");
        if (left == null) {
            left = zero;
        }
        if (right == null) {
            right = Codes.literal(null, new IntegerDomain(), binding);
        }
        Code start;
        BigInteger leftValue = Codes.integerValue(left);
        if (left instanceof LiteralCode && leftValue == null) {
            start = one;
        } else if (leftValue != null && leftValue.signum() >= 0) {
            start = Codes.literal(leftValue.add(BigInteger.ONE), left.domain(), binding);
        } else {
            left = Codes.ifNull(left, zero, binding);
            Code negativeStart = Codes.add(left, opLength, binding);
            Code ifPositive = Codes.compare(">=", left, zero, binding);
            Code ifNegative = Codes.compare(">=", negativeStart, zero, binding);
            start = conditional(List.of(ifPositive, ifNegative), List.of(left, negativeStart), zero, binding);
            start = Codes.add(start, one, binding);
        }
        Code end;
        BigInteger rightValue = Codes.integerValue(right);
        if (right instanceof LiteralCode && rightValue == null) {
            return substring(binding, op, start, null);
        } else if (rightValue != null && rightValue.signum() >= 0) {
            BigInteger startValue = Codes.integerValue(start);
            if (startValue != null) {
                BigInteger value = rightValue.subtract(startValue).add(BigInteger.ONE).max(BigInteger.ZERO);
                return substring(binding, op, start, Codes.literal(value, right.domain(), binding));
            }
            end = Codes.literal(rightValue.add(BigInteger.ONE), right.domain(), binding);
        } else {
            if (!(right instanceof LiteralCode)) {
                right = Codes.ifNull(right, opLength, binding);
            }
            Code negativeEnd = Codes.add(right, opLength, binding);
            Code ifPositive = Codes.compare(">=", right, zero, binding);
            Code ifNegative = Codes.compare(">=", negativeEnd, zero, binding);
            end = conditional(List.of(ifPositive, ifNegative), List.of(right, negativeEnd), zero, binding);
            end = Codes.add(end, one, binding);
        }
        Code length = Codes.subtract(end, start, binding);
        length = Codes.choose(Codes.compare("<", start, end, binding), length, zero, binding);
        return substring(binding, op, start, length);
    }

    private Code encodeAt(FormulaBinding binding) {
        Code op = operand(binding, "op");
        Code opLength = length(op, binding);
        Code zero = Codes.integer(0, binding);
        Code one = Codes.integer(1, binding);
        Code index = operand(binding, "index");
        Code length = operand(binding, "length");
        if (length == null) {
            length = one;
        }
        if (index instanceof LiteralCode literal && literal.value() == null) {
            return substring(binding, op, index, zero);
        }
        if (length instanceof LiteralCode literal && literal.value() == null) {
            length = one;
        }
        BigInteger indexValue = Codes.integerValue(index);
        BigInteger lengthValue = Codes.integerValue(length);
        if (indexValue != null && indexValue.signum() >= 0 && lengthValue != null) {
            if (lengthValue.signum() < 0) {
                indexValue = indexValue.add(lengthValue);
                lengthValue = lengthValue.negate();
            }
            if (indexValue.signum() < 0) {
                lengthValue = lengthValue.add(indexValue);
                indexValue = BigInteger.ZERO;
            }
            lengthValue = lengthValue.max(BigInteger.ZERO);
            return substring(binding, op, Codes.literal(indexValue.add(BigInteger.ONE), index.domain(), binding),
                    Codes.literal(lengthValue, length.domain(), binding));
        }
        length = Codes.ifNull(length, one, binding);
        Code negativeIndex = Codes.add(index, opLength, binding);
        index = Codes.choose(Codes.compare(">=", index, zero, binding), index, negativeIndex, binding);
        Code isForward = Codes.compare(">=", length, zero, binding);
        Code shiftedIndex = Codes.add(index, length, binding);
        Code negativeLength = Codes.unary(Signature.of(SignatureKind.REVERSE_POLARITY), length.domain(), length,
                binding);
        index = Codes.choose(isForward, index, shiftedIndex, binding);
        length = Codes.choose(isForward, length, negativeLength, binding);
        Code isInside = Codes.compare(">=", index, zero, binding);
        Code clippedLength = Codes.add(length, index, binding);
        index = Codes.choose(isInside, index, zero, binding);
        length = Codes.choose(isInside, length, clippedLength, binding);
        length = Codes.choose(Codes.compare(">=", length, zero, binding), length, zero, binding);
        return substring(binding, op, Codes.add(index, one, binding), length);
    }

    private Code conditional(List<Code> predicates, List<Code> consequents, Code alternative, Binding binding) {
        return new FormulaCode(Signature.of(SignatureKind.IF), consequents.get(0).domain(),
                Arguments.<Code>builder()
                    .putList("predicates", predicates)
                    .putList("consequents", consequents)
                    .put("alternative", alternative)
                    .build(), binding);
    }

    private Code encodeReplace(FormulaBinding binding) {
        Code op = operand(binding, "op");
        Code old = operand(binding, "old");
        Code replacement = operand(binding, "new");
        Code empty = new LiteralCode("", old.domain(), binding);
        old = Codes.ifNull(old, empty, binding);
        replacement = Codes.ifNull(replacement, empty, binding);
        return new FormulaCode(binding.signature(), binding.domain(),
                Arguments.<Code>builder().put("op", op).put("old", old).put("new", replacement).build(), binding);
    }

    private Code encodeCount(FormulaBinding binding) {
        Code op = operand(binding, "op");
        Code falseLiteral = new LiteralCode(false, op.domain(), binding);
        op = Codes.binary(Signature.of(SignatureKind.NULL_IF), op.domain(), op, falseLiteral, binding);
        return Codes.unary(binding.signature(), binding.domain(), op, binding);
    }

    // ==================== Aggregates ====================

    /**
     * Finds the plural space an aggregate folds.
     */
    private Space pluralSpace(Code op, Space space, Binding pluralBase) {
        Space plural;
        if (pluralBase != null) {
            plural = relate(pluralBase);
        } else {
            List<Unit> units = new ArrayList<>();
            for (Unit unit : op.units()) {
                if (!space.spans(unit.space())) {
                    units.add(unit);
                }
            }
            if (units.isEmpty()) {
                throw new EncodeError("a plural operand is expected", op.mark());
            }
            plural = dominant(units, op.binding(), "cannot deduce an unambiguous aggregate flow");
        }
        if (space.spans(plural)) {
            throw new EncodeError("a plural operand is expected", op.mark());
        }
        if (!plural.spans(space)) {
            throw new EncodeError("a descendant operand is expected", op.mark());
        }
        return plural;
    }

    private Code encodeAggregate(FormulaBinding binding) {
        Code op = operand(binding, "op");
        Space space = relate(binding.base());
        Space plural = pluralSpace(op, space, binding.arguments().get("plural_base"));
        Code wrapper = intern(new AggregateUnit(op, plural, space, binding));
        if (op instanceof FormulaCode formula
                && (formula.signature().is(SignatureKind.COUNT) || formula.signature().is(SignatureKind.SUM))) {
            Object zero = wrapper.domain().parse("0");
            wrapper = Codes.ifNull(wrapper, new LiteralCode(zero, wrapper.domain(), binding), binding);
        }
        return new ScalarUnit(intern(wrapper), space, binding);
    }

    private Code encodeQuantify(FormulaBinding binding) {
        Code op = operand(binding, "op");
        Space space = relate(binding.base());
        Space plural = pluralSpace(op, space, binding.arguments().get("plural_base"));
        boolean isNegative = binding.signature().polarity() < 0;
        if (isNegative) {
            op = intern(Codes.not(op, binding));
        }
        plural = intern(new FilteredSpace(plural, op, binding));
        CorrelatedUnit unit = intern(new CorrelatedUnit(Codes.bool(true, binding), plural, space, binding));
        Code wrapper = Codes.unary(Signature.of(SignatureKind.EXISTS), new BooleanDomain(), unit, binding);
        if (isNegative) {
            wrapper = Codes.not(intern(wrapper), binding);
        }
        return new ScalarUnit(intern(wrapper), space, binding);
    }

    private <T extends Expression> T intern(T node) {
        return arena.intern(node);
    }
}
