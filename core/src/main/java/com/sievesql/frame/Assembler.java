package com.sievesql.frame;

import com.sievesql.compiler.BinaryTerm;
import com.sievesql.compiler.CorrelationTerm;
import com.sievesql.compiler.EmbeddingTerm;
import com.sievesql.compiler.FilterTerm;
import com.sievesql.compiler.JoinTerm;
import com.sievesql.compiler.Joint;
import com.sievesql.compiler.OrderTerm;
import com.sievesql.compiler.ProjectionTerm;
import com.sievesql.compiler.QueryTerm;
import com.sievesql.compiler.ScalarTerm;
import com.sievesql.compiler.SegmentTerm;
import com.sievesql.compiler.TableTerm;
import com.sievesql.compiler.Term;
import com.sievesql.compiler.UnaryTerm;
import com.sievesql.exception.AssembleError;
import com.sievesql.functions.Arguments;
import com.sievesql.functions.Signature;
import com.sievesql.functions.SignatureKind;
import com.sievesql.space.CastCode;
import com.sievesql.space.Code;
import com.sievesql.space.ColumnUnit;
import com.sievesql.space.CompoundUnit;
import com.sievesql.space.CorrelationCode;
import com.sievesql.space.FormulaCode;
import com.sievesql.space.LiteralCode;
import com.sievesql.space.Order;
import com.sievesql.space.Unit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Translates a term tree into a frame tree.
 *
 * <p>Every unit a term needs is <em>claimed</em>: the claim names the unit,
 * the kid term that has to export it (the broker) and the descendant that
 * actually evaluates it (the target). Claims are collected top-down before
 * a term assembles its kids, so that every kid knows the full list of
 * values to put into its {@code SELECT} list. Each kid then supplies a
 * phrase for every claim it brokers, and the parent reads the phrases back
 * when it evaluates its own clauses.
 *
 * <p>The <em>gate</em> tracks how claims are routed from the current term:
 * which units are routed to which descendants, which kid every descendant
 * is reached through, and whether the rows of the current term may be
 * missing (the right side of an outer join).
 *
 * <p>Example usage:
 * <pre>
 *   QueryFrame frame = new Assembler().assemble(queryTerm);
 * </pre>
 */
public final class Assembler {

    private static final Logger logger = LoggerFactory.getLogger(Assembler.class);

    private record Claim(Unit unit, int broker, int target) {
    }

    private record Gate(boolean isNullable, Map<Integer, Integer> dispatches, Map<Unit, Integer> routes) {
    }

    private final Deque<Gate> gateStack = new ArrayDeque<>();
    private final Deque<Map<Code, Phrase>> correlationsStack = new ArrayDeque<>();
    private Gate gate;
    private Set<Claim> claims;
    private Map<Integer, List<Claim>> claimsByBroker;
    private Map<Claim, Phrase> phraseByClaim;
    private Map<Code, Phrase> correlations = Map.of();

    /**
     * Assembles the frame tree of a compiled query.
     *
     * @param term the compiled query
     * @return the frame tree
     * @throws AssembleError if the term tree is inconsistent
     */
    public QueryFrame assemble(QueryTerm term) {
        SegmentFrame segment = null;
        if (term.segment() != null) {
            try {
                segment = (SegmentFrame) assembleTree(term.segment());
            } finally {
                gateStack.clear();
                correlationsStack.clear();
                correlations = Map.of();
                gate = null;
                claims = null;
                claimsByBroker = null;
                phraseByClaim = null;
            }
        }
        QueryFrame frame = new QueryFrame(segment, term);
        logger.debug("Assembled frame: {}", frame);
        return frame;
    }

    private Frame assembleTree(SegmentTerm term) {
        gate = new Gate(false, term.offsprings(), term.routes());
        claims = new HashSet<>();
        claimsByBroker = new HashMap<>();
        phraseByClaim = new HashMap<>();
        claimsByBroker.put(term.tag(), new ArrayList<>());
        for (Integer offspring : term.offsprings().keySet()) {
            claimsByBroker.put(offspring, new ArrayList<>());
        }
        return assemble(term);
    }

    // ==================== Claims ====================

    private void pushGate(Boolean isNullable, Term dispatcher, Term router) {
        boolean nullable = isNullable != null ? isNullable : gate.isNullable();
        Map<Integer, Integer> dispatches = dispatcher != null ? dispatcher.offsprings() : gate.dispatches();
        if (router == null) {
            router = dispatcher;
        }
        Map<Unit, Integer> routes = router != null ? router.routes() : gate.routes();
        gateStack.push(gate);
        gate = new Gate(nullable, dispatches, routes);
    }

    private void popGate() {
        gate = gateStack.pop();
    }

    private Claim appoint(Unit unit) {
        Integer target = gate.routes().get(unit);
        if (target == null) {
            throw new AssembleError("unable to find a route for a unit " + unit, unit.mark());
        }
        Integer broker = gate.dispatches().get(target);
        if (broker == null) {
            throw new AssembleError("unable to dispatch a unit " + unit, unit.mark());
        }
        return new Claim(unit, broker, target);
    }

    private Claim forward(Claim claim) {
        Integer broker = gate.dispatches().get(claim.target());
        if (broker == null) {
            throw new AssembleError("unable to dispatch a unit " + claim.unit(), claim.unit().mark());
        }
        return new Claim(claim.unit(), broker, claim.target());
    }

    private void schedule(Code code, Term router) {
        pushGate(null, null, router);
        for (Unit unit : code.units()) {
            demand(appoint(unit));
        }
        popGate();
    }

    private void schedule(Code code) {
        schedule(code, null);
    }

    private void demand(Claim claim) {
        if (claims.add(claim)) {
            claimsByBroker.get(claim.broker()).add(claim);
        }
    }

    private void supply(Claim claim, Phrase phrase) {
        if (!claims.contains(claim) || phraseByClaim.containsKey(claim)) {
            throw new AssembleError("unexpected supply of a unit " + claim.unit(), claim.unit().mark());
        }
        phraseByClaim.put(claim, phrase);
    }

    private Phrase supplied(Claim claim) {
        Phrase phrase = phraseByClaim.get(claim);
        if (phrase == null) {
            throw new AssembleError("a unit " + claim.unit() + " is not supplied", claim.unit().mark());
        }
        return phrase;
    }

    // ==================== Terms ====================

    private Frame assemble(Term term) {
        if (term instanceof ScalarTerm) {
            if (!claimsOf(term).isEmpty()) {
                throw new AssembleError("a scalar term cannot export units", term.mark());
            }
            return new ScalarFrame(term.tag(), term);
        }
        if (term instanceof TableTerm table) {
            return assembleTable(table);
        }
        if (term instanceof UnaryTerm || term instanceof BinaryTerm) {
            return assembleBranch(term);
        }
        throw new AssembleError("unexpected term " + term, term.mark());
    }

    private List<Claim> claimsOf(Term term) {
        return claimsByBroker.get(term.tag());
    }

    private Frame assembleTable(TableTerm term) {
        for (Claim claim : claimsOf(term)) {
            if (claim.target() != term.tag() || !(claim.unit() instanceof ColumnUnit unit)
                    || !unit.column().table().equals(term.table())) {
                throw new AssembleError("a table term can only export its own columns", claim.unit().mark());
            }
            boolean isNullable = unit.column().isNullable() || gate.isNullable();
            supply(claim, new ColumnPhrase(term.tag(), unit.column(), isNullable, unit));
        }
        return new TableFrame(term.table(), term.tag(), term);
    }

    private Frame assembleBranch(Term term) {
        delegate(term);
        List<Anchor> include = assembleInclude(term);
        List<NestedFrame> embed = assembleEmbed(term);
        Map<Code, Integer> indexByCode = new HashMap<>();
        List<Phrase> select = term instanceof SegmentTerm segment
                ? assembleSegmentSelect(segment, indexByCode)
                : assembleSelect(term);
        Phrase where = assembleWhere(term);
        List<Phrase> group = assembleGroup(term);
        List<Phrase> order = assembleOrder(term);
        Integer limit = term instanceof OrderTerm orderTerm ? orderTerm.limit() : null;
        Integer offset = term instanceof OrderTerm orderTerm ? orderTerm.offset() : null;
        if (term instanceof SegmentTerm segment) {
            List<Integer> outputIndexes = new ArrayList<>();
            for (Code code : segment.segment().codes()) {
                outputIndexes.add(indexByCode.getOrDefault(code, -1));
            }
            return new SegmentFrame(include, embed, select, where, group, null, order, limit, offset,
                    outputIndexes, term.tag(), segment);
        }
        return new NestedFrame(include, embed, select, where, group, null, order, limit, offset,
                term.tag(), term);
    }

    private void delegate(Term term) {
        List<Claim> brokered = claimsOf(term);
        if (term instanceof SegmentTerm segment) {
            if (!brokered.isEmpty()) {
                throw new AssembleError("a segment term cannot export units", term.mark());
            }
            for (Code code : segment.segment().codes()) {
                schedule(code);
            }
            for (Code code : segment.superkeys()) {
                schedule(code);
            }
            return;
        }
        if (term instanceof CorrelationTerm) {
            if (brokered.size() != 1 || brokered.get(0).target() != term.tag()) {
                throw new AssembleError("a correlated term must export exactly one unit", term.mark());
            }
            schedule(compound(brokered.get(0)).code());
            return;
        }
        if (term instanceof ProjectionTerm projection) {
            pushGate(null, null, projection.kid());
            delegateClaims(term, brokered);
            for (Code code : projection.kernels()) {
                schedule(code);
            }
            popGate();
            return;
        }
        delegateClaims(term, brokered);
        if (term instanceof FilterTerm filter) {
            schedule(filter.filter(), filter.kid());
        } else if (term instanceof OrderTerm orderTerm) {
            for (Order item : orderTerm.order()) {
                schedule(item.code(), orderTerm.kid());
            }
        } else if (term instanceof JoinTerm join) {
            for (Joint joint : join.joints()) {
                schedule(joint.lop(), join.lkid());
                schedule(joint.rop(), join.rkid());
            }
        } else if (term instanceof EmbeddingTerm embedding) {
            for (Code code : embedding.correlations()) {
                schedule(code, embedding.lkid());
            }
        }
    }

    private void delegateClaims(Term term, List<Claim> brokered) {
        for (Claim claim : brokered) {
            if (claim.target() != term.tag()) {
                demand(forward(claim));
            } else {
                schedule(compound(claim).code());
            }
        }
    }

    private CompoundUnit compound(Claim claim) {
        if (!(claim.unit() instanceof CompoundUnit unit)) {
            throw new AssembleError("expected a compound unit", claim.unit().mark());
        }
        return unit;
    }

    private List<Anchor> assembleInclude(Term term) {
        if (term instanceof JoinTerm join) {
            return assembleJoin(join);
        }
        Term kid = term instanceof EmbeddingTerm embedding ? embedding.lkid() : ((UnaryTerm) term).kid();
        pushGate(false, kid, null);
        Frame frame = assemble(kid);
        popGate();
        List<Anchor> include = new ArrayList<>();
        include.add(new LeadingAnchor(frame));
        return include;
    }

    private List<Anchor> assembleJoin(JoinTerm term) {
        pushGate(term.isRight(), term.lkid(), null);
        Frame lframe = assemble(term.lkid());
        popGate();
        pushGate(term.isLeft(), term.rkid(), null);
        Frame rframe = assemble(term.rkid());
        popGate();
        List<Phrase> equalities = new ArrayList<>();
        for (Joint joint : term.joints()) {
            Phrase lop = evaluate(joint.lop(), term.lkid());
            Phrase rop = evaluate(joint.rop(), term.rkid());
            equalities.add(Phrases.isEqual(lop, rop, term.space()));
        }
        Phrase condition = null;
        if (!equalities.isEmpty()) {
            condition = Phrases.and(equalities, term.space());
        } else if (term.isLeft() || term.isRight()) {
            condition = Phrases.toPredicate(new TruePhrase(term.space()));
        }
        List<Anchor> include = new ArrayList<>();
        include.add(new LeadingAnchor(lframe));
        include.add(new Anchor(rframe, condition, term.isLeft(), term.isRight()));
        return include;
    }

    private List<NestedFrame> assembleEmbed(Term term) {
        if (!(term instanceof EmbeddingTerm embedding)) {
            return List.of();
        }
        Map<Code, Phrase> phrases = new HashMap<>();
        for (Code code : embedding.correlations()) {
            phrases.put(code, evaluate(code, embedding.lkid()));
        }
        correlationsStack.push(correlations);
        correlations = phrases;
        pushGate(true, embedding.rkid(), null);
        Frame frame = assemble(embedding.rkid());
        popGate();
        correlations = correlationsStack.pop();
        if (!(frame instanceof NestedFrame nested)) {
            throw new AssembleError("expected a correlated subquery", term.mark());
        }
        return List.of(nested);
    }

    private List<Phrase> assembleSelect(Term term) {
        if (term instanceof CorrelationTerm) {
            Claim claim = claimsOf(term).get(0);
            Phrase phrase = evaluate(compound(claim).code());
            supply(claim, new EmbeddingPhrase(term.tag(), phrase.domain(), true, claim.unit()));
            return List.of(phrase);
        }
        boolean isProjection = term instanceof ProjectionTerm;
        if (isProjection) {
            pushGate(null, null, ((ProjectionTerm) term).kid());
        }
        List<Phrase> select = new ArrayList<>();
        Map<Phrase, Integer> indexByPhrase = new HashMap<>();
        for (Claim claim : claimsOf(term)) {
            Phrase phrase;
            if (claim.target() != term.tag()) {
                phrase = supplied(forward(claim));
            } else {
                phrase = evaluate(compound(claim).code());
            }
            Integer index = indexByPhrase.get(phrase);
            if (index == null) {
                index = select.size();
                select.add(phrase);
                indexByPhrase.put(phrase, index);
            }
            boolean isNullable = phrase.isNullable() || gate.isNullable();
            supply(claim, new ReferencePhrase(term.tag(), index, phrase.domain(), isNullable, claim.unit()));
        }
        if (isProjection) {
            popGate();
        }
        if (select.isEmpty()) {
            select.add(new TruePhrase(term.space()));
        }
        return select;
    }

    private List<Phrase> assembleSegmentSelect(SegmentTerm term, Map<Code, Integer> indexByCode) {
        List<Code> codes = new ArrayList<>(term.segment().codes());
        codes.addAll(term.superkeys());
        List<Phrase> select = new ArrayList<>();
        Map<Phrase, Integer> indexByPhrase = new LinkedHashMap<>();
        for (Code code : codes) {
            Phrase phrase = evaluate(code);
            Integer index = indexByPhrase.get(phrase);
            if (index == null) {
                index = select.size();
                select.add(phrase);
                indexByPhrase.put(phrase, index);
            }
            indexByCode.put(code, index);
        }
        if (select.isEmpty()) {
            select.add(new TruePhrase(term.space()));
        }
        return select;
    }

    private Phrase assembleWhere(Term term) {
        if (!(term instanceof FilterTerm filter)) {
            return null;
        }
        return Phrases.toPredicate(evaluate(filter.filter(), filter.kid()));
    }

    private List<Phrase> assembleGroup(Term term) {
        if (!(term instanceof ProjectionTerm projection)) {
            return List.of();
        }
        List<Phrase> group = new ArrayList<>();
        for (Code code : projection.kernels()) {
            if (code.units().isEmpty()) {
                continue;
            }
            group.add(evaluate(code, projection.kid()));
        }
        if (group.isEmpty()) {
            group.add(new TruePhrase(term.space()));
        }
        return group;
    }

    private List<Phrase> assembleOrder(Term term) {
        if (!(term instanceof OrderTerm orderTerm)) {
            return List.of();
        }
        List<Phrase> order = new ArrayList<>();
        for (Order item : orderTerm.order()) {
            if (item.code().units().isEmpty()) {
                continue;
            }
            Phrase phrase = evaluate(item.code(), orderTerm.kid());
            order.add(Phrases.sortDirection(phrase, item.direction(), item.code()));
        }
        return order;
    }

    // ==================== Codes ====================

    private Phrase evaluate(Code code, Term router) {
        pushGate(null, null, router);
        Phrase phrase = evaluate(code);
        popGate();
        return phrase;
    }

    private Phrase evaluate(Code code) {
        if (code instanceof LiteralCode literal) {
            return new LiteralPhrase(literal.value(), literal.domain(), literal);
        }
        if (code instanceof CastCode cast) {
            Phrase base = evaluate(cast.base());
            return new CastPhrase(base, cast.domain(), base.isNullable(), cast);
        }
        if (code instanceof CorrelationCode correlation) {
            Phrase phrase = correlations.get(correlation.code());
            if (phrase == null) {
                throw new AssembleError("unexpected correlated code " + correlation, code.mark());
            }
            return phrase;
        }
        if (code instanceof FormulaCode formula) {
            return evaluateFormula(formula);
        }
        if (code instanceof Unit unit) {
            return supplied(appoint(unit));
        }
        throw new AssembleError("unexpected code " + code, code.mark());
    }

    private Phrase evaluateFormula(FormulaCode code) {
        Signature signature = code.signature();
        Arguments<Phrase> arguments = code.arguments().map(this::evaluate);
        List<Phrase> cells = arguments.cells();
        boolean anyNullable = cells.stream().anyMatch(Phrase::isNullable);
        switch (signature.kind()) {
            case IS_EQUAL:
            case IS_IN:
            case COMPARE:
            case LIKE:
                return Phrases.fromPredicate(formula(code, arguments, anyNullable));
            case IS_TOTALLY_EQUAL:
            case IS_NULL:
            case EXISTS:
                return Phrases.fromPredicate(formula(code, arguments, false));
            case NULL_IF:
                return formula(code, arguments, true);
            case IF_NULL:
                return formula(code, arguments, cells.stream().allMatch(Phrase::isNullable));
            case AND:
            case OR:
            case NOT: {
                Arguments<Phrase> predicates = arguments.map(Phrases::toPredicate);
                return Phrases.fromPredicate(formula(code, predicates, anyNullable));
            }
            case IF: {
                List<Phrase> predicates = new ArrayList<>();
                for (Phrase predicate : arguments.list("predicates")) {
                    predicates.add(Phrases.toPredicate(predicate));
                }
                return formula(code, arguments.with("predicates", predicates), true);
            }
            case SWITCH:
            case SUM:
            case AVG:
            case MIN_MAX:
                return formula(code, arguments, true);
            case COUNT:
                return formula(code, arguments, false);
            default:
                if (signature.is(SignatureKind.TO_PREDICATE) || signature.is(SignatureKind.FROM_PREDICATE)) {
                    throw new AssembleError("unexpected predicate wrapper", code.mark());
                }
                return formula(code, arguments, anyNullable);
        }
    }

    private static FormulaPhrase formula(FormulaCode code, Arguments<Phrase> arguments, boolean isNullable) {
        return new FormulaPhrase(code.signature(), code.domain(), isNullable, arguments, code);
    }
}
