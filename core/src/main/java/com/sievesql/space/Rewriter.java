package com.sievesql.space;

import com.sievesql.catalog.Column;
import com.sievesql.catalog.Join;
import com.sievesql.exception.EncodeError;
import com.sievesql.types.BooleanDomain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Simplifies an encoded query before it is compiled.
 *
 * <p>The rewriter makes two passes over the expression graph:
 * <ul>
 *   <li><b>rewrite</b> applies local simplifications, such as dropping a
 *       filter that is always true;</li>
 *   <li><b>unmask</b> removes the operations already enforced by the
 *       enclosing space (the <em>mask</em>). For instance, in
 *       {@code school?code='art'{count(department?school.code='art')}} the
 *       inner filter repeats the outer one and is dropped.</li>
 * </ul>
 *
 * <p>Results of both passes are cached; unmasking is cached per mask.
 * A rewriter instance handles one query and is not thread-safe.
 */
public final class Rewriter {

    private static final Logger logger = LoggerFactory.getLogger(Rewriter.class);

    private final Arena arena;
    private final Map<Expression, Expression> rewrites = new HashMap<>();
    private final Map<UnmaskKey, Expression> unmasks = new HashMap<>();
    private final Deque<Space> masks = new ArrayDeque<>();
    private Space root;
    private Space mask;

    public Rewriter(Arena arena) {
        this.arena = Objects.requireNonNull(arena, "arena must not be null");
    }

    public Rewriter() {
        this(new Arena());
    }

    /**
     * Rewrites and unmasks a whole query.
     */
    public QueryExpr rewrite(QueryExpr query) {
        Objects.requireNonNull(query, "query must not be null");
        if (query.segment() == null) {
            return query;
        }
        root = intern(new RootSpace(query.binding()));
        mask = root;
        try {
            SegmentExpr segment = rewriteSegment(query.segment());
            segment = unmaskSegment(segment);
            logger.debug("Rewrote query segment: {}", segment);
            return query.withSegment(segment);
        } finally {
            root = null;
            mask = null;
            masks.clear();
            rewrites.clear();
            unmasks.clear();
        }
    }

    // ==================== Rewrite ====================

    private SegmentExpr rewriteSegment(SegmentExpr segment) {
        Space segmentRoot = rewrite(segment.root());
        Space space = segment.space() != null ? rewrite(segment.space()) : null;
        List<Code> codes = new ArrayList<>();
        for (Code code : segment.codes()) {
            codes.add(rewrite(code));
        }
        return segment.with(segmentRoot, space, codes);
    }

    @SuppressWarnings("unchecked")
    private <T extends Expression> T rewrite(T expression) {
        Expression cached = rewrites.get(expression);
        if (cached == null) {
            if (expression instanceof Space space) {
                cached = intern(rewriteSpace(space));
            } else {
                cached = intern(rewriteCode((Code) expression));
            }
            rewrites.put(expression, cached);
        }
        return (T) cached;
    }

    private Space rewriteSpace(Space space) {
        if (space.base() == null) {
            return space;
        }
        Space base = rewrite(space.base());
        if (space instanceof QuotientSpace quotient) {
            return new QuotientSpace(base, rewrite(quotient.seed()), rewriteAll(quotient.kernels()),
                    quotient.binding());
        }
        if (space instanceof MonikerSpace moniker) {
            return new MonikerSpace(base, rewrite(moniker.seed()), moniker.companions(), moniker.binding());
        }
        if (space instanceof LocatorSpace locator) {
            return new LocatorSpace(base, rewrite(locator.seed()), rewrite(locator.filter()),
                    locator.companions(), locator.binding());
        }
        if (space instanceof FilteredSpace filtered) {
            Code filter = rewrite(filtered.filter());
            if (filter instanceof LiteralCode literal
                    && literal.domain() instanceof BooleanDomain
                    && Boolean.TRUE.equals(literal.value())) {
                return base;
            }
            return new FilteredSpace(base, filter, filtered.binding());
        }
        if (space instanceof OrderedSpace ordered) {
            List<Order> order = new ArrayList<>();
            for (Order item : ordered.order()) {
                order.add(new Order(rewrite(item.code()), item.direction()));
            }
            return new OrderedSpace(base, order, ordered.limit(), ordered.offset(), ordered.binding());
        }
        return space.withBase(base);
    }

    private Code rewriteCode(Code code) {
        if (code instanceof CastCode cast) {
            return new CastCode(rewrite(cast.base()), cast.domain(), cast.binding());
        }
        if (code instanceof FormulaCode formula) {
            return new FormulaCode(formula.signature(), formula.domain(),
                    formula.arguments().map(argument -> rewrite(argument)), formula.binding());
        }
        if (code instanceof KernelUnit unit) {
            int index = unit.space().family() instanceof QuotientFamily family
                    ? family.kernels().indexOf(unit.code()) : -1;
            Space space = rewrite(unit.space());
            return new KernelUnit(kernelAt(space, index, unit), space, unit.binding());
        }
        if (code instanceof PluralUnit unit) {
            return unit.withCode(rewrite(unit.code()))
                    .withPluralSpace(rewrite(unit.pluralSpace()))
                    .withSpace(rewrite(unit.space()));
        }
        if (code instanceof CompoundUnit unit) {
            return unit.withCode(rewrite(unit.code())).withSpace(rewrite(unit.space()));
        }
        if (code instanceof Unit unit) {
            return unit.withSpace(rewrite(unit.space()));
        }
        return code;
    }

    private List<Code> rewriteAll(List<Code> codes) {
        List<Code> result = new ArrayList<>(codes.size());
        for (Code code : codes) {
            result.add(rewrite(code));
        }
        return result;
    }

    // ==================== Unmask ====================

    private SegmentExpr unmaskSegment(SegmentExpr segment) {
        List<Code> codes = new ArrayList<>();
        Space space = segment.space();
        for (Code code : segment.codes()) {
            codes.add(space != null ? unmask(code, space) : unmask(code));
        }
        if (space != null) {
            space = unmask(space, segment.root());
        }
        Space segmentRoot = unmask(segment.root());
        return segment.with(segmentRoot, space, codes);
    }

    private Space unmask(Space space, Space scope) {
        return (Space) unmaskWithin(space, scope);
    }

    private Code unmask(Code code, Space scope) {
        return (Code) unmaskWithin(code, scope);
    }

    private Space unmask(Space space) {
        return (Space) unmaskAny(space);
    }

    private Code unmask(Code code) {
        return (Code) unmaskAny(code);
    }

    private Expression unmaskWithin(Expression expression, Space scope) {
        masks.push(mask);
        mask = scope;
        try {
            return unmaskAny(expression);
        } finally {
            mask = masks.pop();
        }
    }

    private Expression unmaskAny(Expression expression) {
        UnmaskKey key = new UnmaskKey(mask, expression);
        Expression cached = unmasks.get(key);
        if (cached == null) {
            if (expression instanceof Space space) {
                cached = intern(unmaskSpace(space));
            } else {
                cached = intern(unmaskCode((Code) expression));
            }
            unmasks.put(key, cached);
        }
        return cached;
    }

    private Space unmaskSpace(Space space) {
        if (space.base() == null) {
            return space;
        }
        if (space instanceof QuotientSpace quotient) {
            List<Code> kernels = new ArrayList<>();
            boolean isConstant = true;
            for (Code kernel : quotient.kernels()) {
                Code unmasked = unmask(kernel, quotient.seed());
                isConstant &= unmasked.units().isEmpty();
                kernels.add(unmasked);
            }
            if (isConstant) {
                throw new EncodeError("an empty or constant kernel is not allowed", quotient.mark());
            }
            Space seed = unmask(quotient.seed(), quotient.base());
            Space base = unmask(quotient.base());
            return new QuotientSpace(base, seed, kernels, quotient.binding());
        }
        if (space instanceof MonikerSpace moniker) {
            Space seed = unmask(moniker.seed(), moniker.base());
            Space base = unmask(moniker.base());
            return new MonikerSpace(base, seed, moniker.companions(), moniker.binding());
        }
        if (space instanceof LocatorSpace locator) {
            Space seed = unmask(locator.seed(), locator.base());
            Space base = unmask(locator.base());
            Code filter = unmask(locator.filter(), locator.seed());
            return new LocatorSpace(base, seed, filter, locator.companions(), locator.binding());
        }
        if (space instanceof FilteredSpace filtered) {
            if (Objects.equals(filtered.prune(mask), filtered.base().prune(mask))) {
                return unmask(filtered.base());
            }
            Code filter = filtered.base().dominates(mask)
                    ? unmask(filtered.filter())
                    : unmask(filtered.filter(), filtered.base());
            Space base = unmask(filtered.base());
            return new FilteredSpace(base, filter, filtered.binding());
        }
        if (space instanceof OrderedSpace ordered) {
            if (Objects.equals(ordered.prune(mask), ordered.base().prune(mask))) {
                return unmask(ordered.base());
            }
            boolean isDominated = ordered.base().dominates(mask);
            List<Order> order = new ArrayList<>();
            for (Order item : ordered.order()) {
                Code code = isDominated ? unmask(item.code()) : unmask(item.code(), ordered.base());
                order.add(new Order(code, item.direction()));
            }
            Space base = ordered.isExpanding() ? unmask(ordered.base()) : unmask(ordered.base(), root);
            return new OrderedSpace(base, order, ordered.limit(), ordered.offset(), ordered.binding());
        }
        return space.withBase(unmask(space.base()));
    }

    private Code unmaskCode(Code code) {
        if (code instanceof CastCode cast) {
            return new CastCode(unmask(cast.base()), cast.domain(), cast.binding());
        }
        if (code instanceof FormulaCode formula) {
            return new FormulaCode(formula.signature(), formula.domain(),
                    formula.arguments().map(argument -> unmask(argument)), formula.binding());
        }
        if (code instanceof ColumnUnit unit) {
            return unmaskColumn(unit);
        }
        if (code instanceof ScalarUnit unit) {
            if (unit.space().dominates(mask)) {
                return unmask(unit.code());
            }
            if (unit.code() instanceof Unit inner && unit.space().dominates(inner.space())) {
                return unmask(unit.code());
            }
            Code inner = unmask(unit.code(), unit.space());
            return new ScalarUnit(inner, unmask(unit.space()), unit.binding());
        }
        if (code instanceof PluralUnit unit) {
            Code inner = unmask(unit.code(), unit.pluralSpace());
            Space plural = unit.space().dominates(mask)
                    ? unmask(unit.pluralSpace())
                    : unmask(unit.pluralSpace(), unit.space());
            Space space = unmask(unit.space());
            return unit.withCode(inner).withPluralSpace(plural).withSpace(space);
        }
        if (code instanceof KernelUnit unit) {
            int index = unit.space().family() instanceof QuotientFamily family
                    ? family.kernels().indexOf(unit.code()) : -1;
            Space space = unmask(unit.space());
            return new KernelUnit(kernelAt(space, index, unit), space, unit.binding());
        }
        if (code instanceof CoveringUnit unit) {
            Code inner = unmask(unit.code(), unit.covering().seed());
            Space space = unmask(unit.space());
            return new CoveringUnit(inner, space, unit.binding());
        }
        if (code instanceof CompoundUnit unit) {
            return unit.withCode(unmask(unit.code())).withSpace(unmask(unit.space()));
        }
        if (code instanceof Unit unit) {
            return unit.withSpace(unmask(unit.space()));
        }
        return code;
    }

    /**
     * Replaces a column of a one-to-one direct join with the matching
     * column of the join origin, which saves the join.
     */
    private Code unmaskColumn(ColumnUnit unit) {
        Space space = unmask(unit.space());
        Column column = unit.column();
        while (space instanceof FiberTableSpace fiber && fiber.join().isDirect()
                && fiber.isExpanding() && fiber.isContracting()) {
            Join join = fiber.join();
            int index = indexOf(join.targetColumns(), column);
            if (index < 0) {
                break;
            }
            space = fiber.base();
            column = join.originColumns().get(index);
        }
        return unit.with(column, space);
    }

    private static int indexOf(List<Column> columns, Column column) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i) == column) {
                return i;
            }
        }
        return -1;
    }

    private static Code kernelAt(Space space, int index, KernelUnit unit) {
        if (index < 0 || !(space.family() instanceof QuotientFamily family)) {
            throw new IllegalStateException("kernel unit does not match its quotient: " + unit);
        }
        return family.kernels().get(index);
    }

    private <T extends Expression> T intern(T node) {
        return arena.intern(node);
    }

    private record UnmaskKey(Space mask, Expression expression) {
    }
}
