package com.sievesql.compiler;

import com.sievesql.exception.CompileError;
import com.sievesql.space.AggregateUnit;
import com.sievesql.space.Code;
import com.sievesql.space.Codes;
import com.sievesql.space.ColumnUnit;
import com.sievesql.space.ComplementSpace;
import com.sievesql.space.CorrelatedUnit;
import com.sievesql.space.CorrelationCode;
import com.sievesql.space.CoveringSpace;
import com.sievesql.space.CoveringUnit;
import com.sievesql.space.Expression;
import com.sievesql.space.FilteredSpace;
import com.sievesql.space.KernelUnit;
import com.sievesql.space.LocatorSpace;
import com.sievesql.space.Order;
import com.sievesql.space.OrderedSpace;
import com.sievesql.space.QueryExpr;
import com.sievesql.space.QuotientSpace;
import com.sievesql.space.RootSpace;
import com.sievesql.space.ScalarUnit;
import com.sievesql.space.SegmentExpr;
import com.sievesql.space.Space;
import com.sievesql.space.TableSpace;
import com.sievesql.space.Unit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Translates a rewritten query into a tree of terms.
 *
 * <p>Every space is compiled relative to a <em>baseline</em>: the lowest
 * axis the resulting term has to cover. Axes below the baseline are
 * supplied by the parent term through a join. Codes are then
 * <em>injected</em> into a term, which extends it with the joins needed to
 * evaluate them and records, in the term routes, where each unit lives.
 *
 * <p>How a sliced space ({@code LIMIT}/{@code OFFSET}) is compiled depends
 * on the backend and is delegated to a {@link PaginationStrategy}.
 *
 * <p>A compiler instance is not thread-safe; use one per query.
 */
public final class Compiler {

    private static final Logger logger = LoggerFactory.getLogger(Compiler.class);

    private final PaginationStrategy pagination;
    private final Deque<Space> baselines = new ArrayDeque<>();
    private int nextTag;
    private Space root;
    private Space baseline;

    public Compiler(PaginationStrategy pagination) {
        this.pagination = Objects.requireNonNull(pagination, "pagination must not be null");
    }

    public Compiler() {
        this(new LimitOffsetPagination());
    }

    /**
     * Compiles a whole query.
     */
    public QueryTerm compile(QueryExpr query) {
        Objects.requireNonNull(query, "query must not be null");
        nextTag = 1;
        root = new RootSpace(query.binding());
        baseline = root;
        try {
            SegmentTerm segment = query.segment() != null ? compileSegment(query.segment()) : null;
            logger.debug("Compiled term tree: {}", segment);
            return new QueryTerm(segment, query);
        } finally {
            root = null;
            baseline = null;
            baselines.clear();
        }
    }

    // ==================== State ====================

    int tag() {
        return nextTag++;
    }

    Space root() {
        return root;
    }

    /**
     * Compiles a space against the given baseline.
     */
    Term compile(Space space, Space baseline) {
        if (!baseline.isInflated()) {
            throw new IllegalArgumentException("baseline must be inflated: " + baseline);
        }
        baselines.push(this.baseline);
        this.baseline = baseline;
        try {
            return compile(space);
        } finally {
            this.baseline = baselines.pop();
        }
    }

    /**
     * Extends the term so that it routes every unit of the expressions.
     */
    Term inject(Term term, List<? extends Expression> expressions) {
        for (Expression expression : expressions) {
            if (expression instanceof Unit unit && term.routes().containsKey(unit)) {
                continue;
            }
            term = injectOne(term, expression);
        }
        return term;
    }

    static Map<Unit, Integer> spreadRoutes(Term term, Space space, Space backbone) {
        Map<Unit, Integer> routes = term.copyRoutes();
        for (Unit unit : Stitcher.spread(space)) {
            routes.put(unit, route(term, unit.withSpace(backbone)));
        }
        return routes;
    }

    private static int route(Term term, Unit unit) {
        Integer tag = term.routes().get(unit);
        if (tag == null) {
            throw new IllegalStateException("unit " + unit + " is not routed by " + term);
        }
        return tag;
    }

    // ==================== Segment ====================

    private SegmentTerm compileSegment(SegmentExpr segment) {
        Space superspace = root;
        if (!superspace.spans(segment.root())) {
            throw new CompileError("a singular expression is expected", segment.root().mark());
        }
        List<Space> chain = new ArrayList<>(List.of(superspace, segment.root(), segment.space()));
        List<Order> order = new ArrayList<>();
        Set<Code> duplicates = new HashSet<>();
        for (Space space : chain) {
            for (Order item : Stitcher.arrange(space)) {
                if (duplicates.add(item.code())) {
                    order.add(item);
                }
            }
        }
        List<Code> codes = new ArrayList<>(segment.codes());
        for (Order item : order) {
            codes.add(item.code());
        }
        int idx = 0;
        while (idx + 1 < chain.size()) {
            Space parent = chain.get(idx);
            boolean isNative = false;
            for (Space child = chain.get(idx + 1); child != null; child = child.base()) {
                if (parent.dominates(child)) {
                    isNative = true;
                    break;
                }
            }
            if (isNative) {
                chain.remove(idx);
                if (idx > 0) {
                    idx--;
                }
            } else {
                idx++;
            }
        }
        Term trunk = compile(chain.get(0), root);
        for (Space space : chain.subList(1, chain.size())) {
            Term shoot = compileShoot(space, trunk.space(), null);
            List<Joint> joints = glueTerms(trunk, shoot);
            trunk = injectJoints(trunk, joints);
            Map<Unit, Integer> routes = trunk.copyRoutes();
            routes.putAll(shoot.routes());
            trunk = new JoinTerm(tag(), trunk, shoot, joints, false, false, shoot.space(), root, routes);
        }
        Term kid = inject(trunk, codes);
        if (!order.isEmpty()) {
            kid = new OrderTerm(tag(), kid, order, null, null, kid.space(), kid.baseline(), kid.routes());
        }
        List<Code> superkeys = keys(superspace);
        List<Code> keys = keys(segment.space());
        return new SegmentTerm(tag(), kid, segment, superkeys, keys, kid.space(), kid.baseline(), kid.routes());
    }

    private static List<Code> keys(Space space) {
        List<Code> keys = new ArrayList<>();
        for (Order item : Stitcher.arrange(space, false, true)) {
            keys.add(item.code());
        }
        return keys;
    }

    // ==================== Spaces ====================

    private Term compile(Space space) {
        if (!space.concludes(baseline)) {
            throw new IllegalStateException("space " + space + " does not conclude baseline " + baseline);
        }
        if (space instanceof TableSpace) {
            return compileTable(space);
        }
        if (space instanceof QuotientSpace quotient) {
            return compileQuotient(quotient);
        }
        if (space instanceof ComplementSpace complement) {
            return compileComplement(complement);
        }
        if (space instanceof CoveringSpace covering) {
            return compileCovering(covering);
        }
        if (space instanceof FilteredSpace filtered) {
            return compileFiltered(filtered);
        }
        if (space instanceof OrderedSpace ordered) {
            return compileOrdered(ordered);
        }
        return compileScalar(space);
    }

    private Term compileScalar(Space space) {
        if (space.equals(baseline)) {
            return new ScalarTerm(tag(), space, space, Map.of());
        }
        Term term = compile(space.base());
        return new WrapperTerm(tag(), term, space, term.baseline(), term.routes());
    }

    private Term compileTable(Space space) {
        Space backbone = space.inflate();
        if (space.equals(baseline)) {
            Map<Unit, Integer> routes = new LinkedHashMap<>();
            int tag = tag();
            for (Unit unit : Stitcher.spread(space)) {
                routes.put(unit, tag);
            }
            return new TableTerm(tag, space, routes);
        }
        Term term = compile(space.base());
        if (space.conforms(term.space()) && term.routes().keySet().containsAll(Stitcher.spread(backbone))) {
            return new WrapperTerm(tag(), term, space, term.baseline(), spreadRoutes(term, space, backbone));
        }
        Term lkid = term;
        Term rkid = compile(backbone, backbone);
        List<Joint> joints = Stitcher.tie(space);
        Map<Unit, Integer> routes = lkid.copyRoutes();
        routes.putAll(rkid.routes());
        for (Unit unit : Stitcher.spread(space)) {
            routes.put(unit, route(rkid, unit.withSpace(backbone)));
        }
        return new JoinTerm(tag(), lkid, rkid, joints, false, false, space, lkid.baseline(), routes);
    }

    private Term compileQuotient(QuotientSpace space) {
        Space backbone = space.inflate();
        Term seedTerm = compile(space.seed(), inflatedBase(space.ground()));
        if (!space.kernels().isEmpty()) {
            seedTerm = inject(seedTerm, space.kernels());
            List<Code> filters = new ArrayList<>();
            for (Code kernel : space.kernels()) {
                filters.add(Codes.isNotNull(kernel, kernel.binding()));
            }
            seedTerm = new FilterTerm(tag(), seedTerm, Codes.and(filters, space.binding()),
                    seedTerm.space(), seedTerm.baseline(), seedTerm.routes());
        }
        seedTerm = new WrapperTerm(tag(), seedTerm, seedTerm.space(), seedTerm.baseline(), seedTerm.routes());
        boolean isRegular = seedTerm.baseline().equals(space.ground());
        Term trunk = null;
        List<Code> basis = new ArrayList<>();
        List<Unit> units = new ArrayList<>();
        List<Joint> joints = new ArrayList<>();
        if (isRegular) {
            if (!space.equals(baseline)) {
                trunk = compile(space.base());
                joints = Stitcher.tie(space);
            }
        } else {
            Space trunkBaseline = baseline.equals(space) ? baseline.base() : baseline;
            trunk = compile(space.base(), trunkBaseline);
            for (Joint joint : glueTerms(trunk, seedTerm)) {
                basis.add(joint.rop());
                KernelUnit unit = new KernelUnit(joint.rop(), backbone, joint.rop().binding());
                units.add(unit);
                joints.add(joint.withRop(unit));
            }
        }
        for (Joint joint : Stitcher.tie(space.ground())) {
            basis.add(joint.rop());
            units.add(new KernelUnit(joint.rop(), backbone, joint.rop().binding()));
        }
        for (Code kernel : space.kernels()) {
            basis.add(kernel);
            units.add(new KernelUnit(kernel, backbone, kernel.binding()));
        }
        if (space.kernels().stream().allMatch(kernel -> kernel.units().isEmpty())) {
            ScalarUnit basisUnit = new ScalarUnit(Codes.bool(true, space.binding()), space.seed(), space.binding());
            basis.add(basisUnit);
            Map<Unit, Integer> routes = seedTerm.copyRoutes();
            routes.put(basisUnit, seedTerm.tag());
            seedTerm = new PermanentTerm(tag(), seedTerm, seedTerm.space(), seedTerm.baseline(), routes);
        }
        int tag = tag();
        Map<Unit, Integer> routes = new LinkedHashMap<>();
        for (Unit unit : units) {
            routes.put(unit, tag);
        }
        Term term = new ProjectionTerm(tag, seedTerm, basis, backbone, backbone, routes);
        if (trunk == null) {
            return term;
        }
        Term lkid = injectJoints(trunk, joints);
        routes = lkid.copyRoutes();
        routes.putAll(term.routes());
        for (Unit unit : units) {
            routes.put(unit.withSpace(space), term.tag());
        }
        return new JoinTerm(tag(), lkid, term, joints, false, false, space, lkid.baseline(), routes);
    }

    private Term compileComplement(ComplementSpace space) {
        Space backbone = space.inflate();
        Term seedTerm = compile(space.seed(), inflatedBase(space.ground()));
        List<Code> extra = new ArrayList<>(space.kernels());
        extra.addAll(space.companions());
        seedTerm = inject(seedTerm, extra);
        boolean isRegular = seedTerm.baseline().equals(space.ground());
        boolean hasQuotient = (!baseline.equals(space) || !isRegular) && space.base() instanceof QuotientSpace;
        if (hasQuotient && !space.kernels().isEmpty()) {
            List<Code> filters = new ArrayList<>();
            for (Code kernel : space.kernels()) {
                filters.add(Codes.isNotNull(kernel, kernel.binding()));
            }
            seedTerm = new FilterTerm(tag(), seedTerm, Codes.and(filters, space.binding()),
                    seedTerm.space(), seedTerm.baseline(), seedTerm.routes());
        }
        seedTerm = new WrapperTerm(tag(), seedTerm, seedTerm.space(), seedTerm.baseline(), seedTerm.routes());
        Term trunk = null;
        List<Unit> coveringUnits = new ArrayList<>();
        List<Unit> quotientUnits = new ArrayList<>();
        List<Joint> joints = new ArrayList<>();
        Space axis = hasQuotient ? space.base().base() : space.base();
        Space trunkBaseline = baseline;
        if (!isRegular) {
            while (!axis.concludes(trunkBaseline)) {
                trunkBaseline = trunkBaseline.base();
            }
        }
        if (axis.concludes(trunkBaseline)) {
            trunk = compile(axis, trunkBaseline);
        }
        if (trunk != null) {
            if (!isRegular) {
                for (Joint joint : glueTerms(trunk, seedTerm)) {
                    CoveringUnit unit = new CoveringUnit(joint.rop(), backbone, joint.rop().binding());
                    joints.add(joint.withRop(unit));
                    coveringUnits.add(unit);
                }
            }
            joints.addAll(Stitcher.tie(hasQuotient ? space.base() : space));
        }
        if (hasQuotient) {
            quotientUnits = Stitcher.spread(space.base().inflate());
        }
        for (Unit unit : seedTerm.routes().keySet()) {
            coveringUnits.add(new CoveringUnit(unit, backbone, unit.binding()));
        }
        for (Joint joint : Stitcher.tie(space.ground())) {
            coveringUnits.add(new CoveringUnit(joint.rop(), backbone, joint.rop().binding()));
        }
        for (Code code : extra) {
            coveringUnits.add(new CoveringUnit(code, backbone, code.binding()));
        }
        Map<Unit, Integer> routes = new LinkedHashMap<>();
        for (Unit unit : quotientUnits) {
            routes.put(unit, seedTerm.tag());
        }
        for (Unit unit : coveringUnits) {
            routes.put(unit, seedTerm.tag());
        }
        for (Unit unit : Stitcher.spread(space.seed())) {
            routes.put(unit.withSpace(backbone), route(seedTerm, unit));
        }
        Space termBaseline = hasQuotient ? backbone.base() : backbone;
        Term term = new WrapperTerm(tag(), seedTerm, backbone, termBaseline, routes);
        if (trunk == null) {
            return term;
        }
        Term lkid = injectJoints(trunk, joints);
        routes = lkid.copyRoutes();
        routes.putAll(term.routes());
        for (Unit unit : quotientUnits) {
            routes.put(unit.withSpace(space.base()), seedTerm.tag());
        }
        for (Unit unit : coveringUnits) {
            routes.put(unit.withSpace(space), seedTerm.tag());
        }
        for (Unit unit : Stitcher.spread(space.seed())) {
            routes.put(unit.withSpace(space), route(seedTerm, unit));
        }
        return new JoinTerm(tag(), lkid, term, joints, false, false, space, lkid.baseline(), routes);
    }

    private Term compileCovering(CoveringSpace space) {
        Space backbone = space.inflate();
        Term seedTerm = compile(space.seed(), inflatedBase(space.ground()));
        List<Code> codes = new ArrayList<>();
        if (space instanceof LocatorSpace locator) {
            codes.add(locator.filter());
        }
        codes.addAll(space.companions());
        seedTerm = inject(seedTerm, codes);
        if (space instanceof LocatorSpace locator) {
            seedTerm = new FilterTerm(tag(), seedTerm, locator.filter(),
                    seedTerm.space(), seedTerm.baseline(), seedTerm.routes());
        }
        boolean isRegular = seedTerm.baseline().equals(space.ground());
        seedTerm = new WrapperTerm(tag(), seedTerm, seedTerm.space(), seedTerm.baseline(), seedTerm.routes());
        Term trunk = null;
        List<Joint> joints = new ArrayList<>();
        if (isRegular) {
            if (!baseline.equals(space)) {
                trunk = compile(space.base());
            }
            joints.addAll(Stitcher.tie(space));
        } else {
            Space trunkBaseline = baseline.equals(space) ? baseline.base() : baseline;
            trunk = compile(space.base(), trunkBaseline);
            for (Joint joint : glueTerms(trunk, seedTerm)) {
                joints.add(joint.withRop(new CoveringUnit(joint.rop(), backbone, joint.rop().binding())));
            }
            joints.addAll(Stitcher.tie(space));
        }
        List<Unit> units = new ArrayList<>();
        for (Unit unit : seedTerm.routes().keySet()) {
            units.add(new CoveringUnit(unit, backbone, unit.binding()));
        }
        for (Joint joint : joints) {
            units.add((Unit) joint.rop());
        }
        for (Code code : codes) {
            units.add(new CoveringUnit(code, backbone, code.binding()));
        }
        Map<Unit, Integer> routes = new LinkedHashMap<>();
        for (Unit unit : units) {
            routes.put(unit, seedTerm.tag());
        }
        for (Unit unit : Stitcher.spread(space.seed())) {
            routes.put(unit.withSpace(backbone), route(seedTerm, unit));
        }
        Term term = new WrapperTerm(tag(), seedTerm, backbone, backbone, routes);
        if (trunk == null) {
            return term;
        }
        Term lkid = injectJoints(trunk, joints);
        routes = lkid.copyRoutes();
        routes.putAll(term.routes());
        for (Unit unit : units) {
            routes.put(unit.withSpace(space), seedTerm.tag());
        }
        for (Unit unit : Stitcher.spread(space.seed())) {
            routes.put(unit.withSpace(space), route(seedTerm, unit));
        }
        return new JoinTerm(tag(), lkid, term, joints, false, false, space, lkid.baseline(), routes);
    }

    private Term compileFiltered(FilteredSpace space) {
        Term kid = inject(compile(space.base()), List.of(space.filter()));
        return new FilterTerm(tag(), kid, space.filter(), space, kid.baseline(),
                spreadRoutes(kid, space, space.inflate()));
    }

    private Term compileOrdered(OrderedSpace space) {
        if (space.isExpanding()) {
            Term term = compile(space.base());
            return new WrapperTerm(tag(), term, space, term.baseline(), spreadRoutes(term, space, space.inflate()));
        }
        return pagination.compile(space, this);
    }

    private static Space inflatedBase(Space space) {
        while (!space.isInflated()) {
            space = space.base();
        }
        return space;
    }

    // ==================== Connecting terms ====================

    /**
     * Compiles a space that is to be attached to a trunk term, covering
     * only the axes the trunk does not span.
     */
    private Term compileShoot(Space space, Space trunk, List<? extends Expression> codes) {
        Space shootBaseline = inflatedBase(space);
        if (!trunk.spans(shootBaseline)) {
            while (!trunk.spans(shootBaseline.base())) {
                shootBaseline = shootBaseline.base();
            }
        }
        Term term = compile(space, shootBaseline);
        if (codes != null) {
            term = inject(term, codes);
        }
        return term;
    }

    private List<Joint> glueSpaces(Space space, Space spaceBaseline, Space shoot, Space shootBaseline) {
        List<Joint> joints = new ArrayList<>();
        Space backbone = space.inflate();
        Space shootBackbone = shoot.inflate();
        if (backbone.concludes(shootBaseline)) {
            Space axis = backbone;
            while (!shootBackbone.concludes(axis)) {
                axis = axis.base();
            }
            List<Space> axes = new ArrayList<>();
            while (axis != null && !axis.equals(shootBaseline.base())) {
                if (!axis.isContracting() || axis.equals(shootBaseline)) {
                    axes.add(axis);
                }
                axis = axis.base();
            }
            Collections.reverse(axes);
            for (Space item : axes) {
                joints.addAll(Stitcher.sew(item));
            }
            return joints;
        }
        joints.addAll(Stitcher.tie(shootBaseline));
        Space origin = shootBaseline.base();
        if (origin != null && spaceBaseline.concludes(origin) && !spaceBaseline.equals(origin)) {
            Space axis = spaceBaseline;
            while (!axis.base().equals(origin)) {
                axis = axis.base();
            }
            List<Joint> trunkJoints = Stitcher.tie(axis);
            if (trunkJoints.size() == joints.size() && sameLops(trunkJoints, joints)) {
                List<Joint> glued = new ArrayList<>();
                for (int i = 0; i < joints.size(); i++) {
                    glued.add(new Joint(trunkJoints.get(i).rop(), joints.get(i).rop()));
                }
                return glued;
            }
        }
        return joints;
    }

    private static boolean sameLops(List<Joint> left, List<Joint> right) {
        for (int i = 0; i < left.size(); i++) {
            if (!left.get(i).lop().equals(right.get(i).lop())) {
                return false;
            }
        }
        return true;
    }

    private List<Joint> glueTerms(Term trunk, Term shoot) {
        return glueSpaces(trunk.space(), trunk.baseline(), shoot.space(), shoot.baseline());
    }

    private Term injectJoints(Term term, List<Joint> joints) {
        List<Code> codes = new ArrayList<>();
        for (Joint joint : joints) {
            codes.add(joint.lop());
        }
        return inject(term, codes);
    }

    private Term joinTerms(Term trunk, Term shoot, Map<Unit, Integer> extraRoutes) {
        List<Joint> joints = glueTerms(trunk, shoot);
        trunk = injectJoints(trunk, joints);
        Space space = trunk.space();
        while (!shoot.space().spans(space)) {
            space = space.base();
        }
        boolean isLeft = !shoot.space().dominates(space);
        Map<Unit, Integer> routes = trunk.copyRoutes();
        routes.putAll(extraRoutes);
        return new JoinTerm(tag(), trunk, shoot, joints, isLeft, false, trunk.space(), trunk.baseline(), routes);
    }

    // ==================== Injection ====================

    private Term injectOne(Term term, Expression expression) {
        if (expression instanceof Space space) {
            return injectSpace(term, space);
        }
        if (expression instanceof ColumnUnit unit) {
            requireSingular(term, unit);
            return inject(term, List.of(unit.space()));
        }
        if (expression instanceof ScalarUnit unit) {
            return injectScalar(term, unit);
        }
        if (expression instanceof AggregateUnit unit) {
            return injectAggregate(term, unit);
        }
        if (expression instanceof CorrelatedUnit unit) {
            return injectCorrelated(term, unit);
        }
        if (expression instanceof KernelUnit unit) {
            requireSingular(term, unit);
            Term result = inject(term, List.of(unit.space()));
            route(result, unit);
            return result;
        }
        if (expression instanceof CoveringUnit unit) {
            return injectCovering(term, unit);
        }
        if (expression instanceof Code code) {
            return inject(term, code.units());
        }
        throw new IllegalArgumentException("cannot inject " + expression);
    }

    private static void requireSingular(Term term, Unit unit) {
        if (!term.space().spans(unit.space())) {
            throw new CompileError("a singular expression is expected", unit.mark());
        }
    }

    private Term injectSpace(Term term, Space space) {
        List<Unit> spread = Stitcher.spread(space);
        if (term.routes().keySet().containsAll(spread)) {
            return term;
        }
        if (term.space().concludes(space)) {
            Term lkid = compile(term.baseline().base(), space);
            List<Joint> joints = Stitcher.tie(term.baseline());
            lkid = injectJoints(lkid, joints);
            Map<Unit, Integer> routes = lkid.copyRoutes();
            routes.putAll(term.routes());
            return new JoinTerm(tag(), lkid, term, joints, false, false, term.space(), lkid.baseline(), routes);
        }
        Term spaceTerm = compileShoot(space, term.space(), null);
        Map<Unit, Integer> extraRoutes = new LinkedHashMap<>();
        for (Unit unit : spread) {
            extraRoutes.put(unit, route(spaceTerm, unit));
        }
        return joinTerms(term, spaceTerm, extraRoutes);
    }

    private Term injectScalar(Term term, ScalarUnit unit) {
        requireSingular(term, unit);
        List<Code> codes = List.of(unit.code());
        if (unit.space().dominates(term.space())) {
            Term kid = inject(term, codes);
            int tag = tag();
            Map<Unit, Integer> routes = kid.copyRoutes();
            routes.put(unit, tag);
            return new WrapperTerm(tag, kid, kid.space(), kid.baseline(), routes);
        }
        Term unitTerm = compileShoot(unit.space(), term.space(), codes);
        if (unitTerm.isNullary()) {
            unitTerm = new WrapperTerm(tag(), unitTerm, unitTerm.space(), unitTerm.baseline(), unitTerm.routes());
        }
        return joinTerms(term, unitTerm, Map.of(unit, unitTerm.tag()));
    }

    private Term injectAggregate(Term term, AggregateUnit unit) {
        requireSingular(term, unit);
        List<Code> codes = List.of(unit.code());
        boolean isNative = false;
        for (Space space = term.space(); space != null; space = space.base()) {
            if (unit.space().dominates(space)) {
                isNative = true;
                break;
            }
        }
        Term unitTerm;
        if (isNative) {
            unitTerm = term;
        } else {
            unitTerm = compileShoot(unit.space(), term.space(), null);
        }
        Term pluralTerm = compileShoot(unit.pluralSpace(), unitTerm.space(), codes);
        List<Joint> unitJoints = glueSpaces(unitTerm.space(), unitTerm.baseline(),
                pluralTerm.space(), pluralTerm.baseline());
        unitTerm = injectJoints(unitTerm, unitJoints);
        List<Code> basis = new ArrayList<>();
        for (Joint joint : unitJoints) {
            basis.add(joint.rop());
        }
        Space projected = new QuotientSpace(unit.space().inflate(), unit.pluralSpace(), List.of(), unit.binding());
        int tag = tag();
        List<Joint> joints = new ArrayList<>();
        Map<Unit, Integer> routes = new LinkedHashMap<>();
        for (Joint joint : unitJoints) {
            KernelUnit rop = new KernelUnit(joint.rop(), projected, joint.rop().binding());
            routes.put(rop, tag);
            joints.add(joint.withRop(rop));
        }
        Term projectedTerm = new ProjectionTerm(tag, pluralTerm, basis, projected, projected, routes);
        boolean isLeft = !projected.dominates(unitTerm.space());
        routes = unitTerm.copyRoutes();
        routes.put(unit, projectedTerm.tag());
        unitTerm = new JoinTerm(tag(), unitTerm, projectedTerm, joints, isLeft, false,
                unitTerm.space(), unitTerm.baseline(), routes);
        if (isNative) {
            return unitTerm;
        }
        return joinTerms(term, unitTerm, Map.of(unit, projectedTerm.tag()));
    }

    private Term injectCorrelated(Term term, CorrelatedUnit unit) {
        requireSingular(term, unit);
        boolean isNative = unit.space().dominates(term.space());
        Term unitTerm = isNative ? term : compileShoot(unit.space(), term.space(), null);
        Term pluralTerm = compileShoot(unit.pluralSpace(), unitTerm.space(), List.of(unit.code()));
        List<Joint> joints = glueTerms(unitTerm, pluralTerm);
        unitTerm = injectJoints(unitTerm, joints);
        List<Code> correlations = new ArrayList<>();
        List<Code> filters = new ArrayList<>();
        for (Joint joint : joints) {
            correlations.add(joint.lop());
            filters.add(Codes.isEqual(new CorrelationCode(joint.lop()), joint.rop(), unit.binding()));
        }
        if (!filters.isEmpty()) {
            pluralTerm = new FilterTerm(tag(), pluralTerm, Codes.and(filters, unit.binding()),
                    pluralTerm.space(), pluralTerm.baseline(), pluralTerm.routes());
        }
        pluralTerm = new CorrelationTerm(tag(), pluralTerm, pluralTerm.space(), pluralTerm.baseline(),
                pluralTerm.routes());
        Map<Unit, Integer> routes = unitTerm.copyRoutes();
        routes.put(unit, pluralTerm.tag());
        unitTerm = new EmbeddingTerm(tag(), unitTerm, pluralTerm, correlations,
                unitTerm.space(), unitTerm.baseline(), routes);
        if (isNative) {
            return unitTerm;
        }
        return joinTerms(term, unitTerm, Map.of(unit, pluralTerm.tag()));
    }

    private Term injectCovering(Term term, CoveringUnit unit) {
        requireSingular(term, unit);
        List<Code> companions = new ArrayList<>(unit.covering().companions());
        companions.add(unit.code());
        Space space = withCompanions(unit.space(), companions);
        Term spaceTerm = compileShoot(space, term.space(), null);
        Term result = joinTerms(term, spaceTerm, Map.of(unit, route(spaceTerm, unit)));
        route(result, unit);
        return result;
    }

    /**
     * Rebuilds the chain with companions attached to its covering axis.
     */
    private static Space withCompanions(Space space, List<Code> companions) {
        if (space instanceof CoveringSpace covering) {
            return covering.withCompanions(companions);
        }
        return space.withBase(withCompanions(space.base(), companions));
    }

    // ==================== Helpers for pagination ====================

    /**
     * Returns the routes of a kid extended with the units of a space whose
     * backbone the kid already routes.
     */
    Map<Unit, Integer> routesOf(Term kid, Space space) {
        return spreadRoutes(kid, space, space.inflate());
    }

    /**
     * Compiles the base of a sliced space with its ordering codes injected.
     */
    Term compileSlicedBase(OrderedSpace space, List<Order> order) {
        Term kid = compile(space.base(), root);
        List<Code> codes = new ArrayList<>();
        for (Order item : order) {
            codes.add(item.code());
        }
        return inject(kid, codes);
    }
}
