package com.sievesql.reducer;

import com.sievesql.compiler.PermanentTerm;
import com.sievesql.frame.Anchor;
import com.sievesql.frame.BranchFrame;
import com.sievesql.frame.CastPhrase;
import com.sievesql.frame.ColumnPhrase;
import com.sievesql.frame.FormulaPhrase;
import com.sievesql.frame.Frame;
import com.sievesql.frame.LeadingAnchor;
import com.sievesql.frame.LiteralPhrase;
import com.sievesql.frame.NestedFrame;
import com.sievesql.frame.NullPhrase;
import com.sievesql.frame.Phrase;
import com.sievesql.frame.Phrases;
import com.sievesql.frame.QueryFrame;
import com.sievesql.frame.ReferencePhrase;
import com.sievesql.frame.ScalarFrame;
import com.sievesql.frame.SegmentFrame;
import com.sievesql.frame.TruePhrase;
import com.sievesql.functions.Arguments;
import com.sievesql.functions.Signature;
import com.sievesql.functions.SignatureKind;
import com.sievesql.generator.Dialect;
import com.sievesql.types.TextDomain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Simplifies a frame tree before serialization.
 *
 * <p>The reducer folds constant expressions, drops redundant wrappers
 * ({@code IFNULL} over a non-nullable value, a cast to the same type, a
 * literal {@code TRUE} filter) and merges subqueries into the frames that
 * include them. A merged subquery disappears, so references to its
 * {@code SELECT} list are replaced with the phrases they point to.
 *
 * <p>Reduction runs whole passes until the tree stops changing, so
 * reducing an already reduced tree returns it unchanged.
 *
 * <p>The dialect decides two things: whether a Boolean value can be used
 * as a condition directly (if not, conditions and values are converted
 * explicitly and every {@code SELECT} needs a {@code FROM} clause).
 */
public final class Reducer {

    private static final Logger logger = LoggerFactory.getLogger(Reducer.class);

    private static final int MAX_PASSES = 16;

    private record Reference(int tag, int index) {
    }

    private final Dialect dialect;
    private final Map<Reference, Phrase> substitutes = new HashMap<>();
    private int lastTag;

    public Reducer(Dialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
    }

    // ==================== Entry points ====================

    /**
     * Reduces a query frame.
     *
     * @param frame the assembled frame
     * @return the reduced frame
     */
    public QueryFrame reduce(QueryFrame frame) {
        if (frame.segment() == null) {
            return frame;
        }
        lastTag = maxTag(frame.segment());
        QueryFrame current = frame;
        for (int pass = 1; pass <= MAX_PASSES; pass++) {
            substitutes.clear();
            SegmentFrame segment = (SegmentFrame) collapse(current.segment());
            QueryFrame next = current.withSegment(segment);
            if (next.equals(current)) {
                logger.debug("Frame reduced in {} pass(es): {}", pass, next.segment());
                return next;
            }
            current = next;
        }
        logger.debug("Frame reduction stopped after {} passes", MAX_PASSES);
        return current;
    }

    /**
     * Reduces a standalone phrase.
     */
    public Phrase reduce(Phrase phrase) {
        Phrase current = phrase;
        for (int pass = 1; pass <= MAX_PASSES; pass++) {
            substitutes.clear();
            Phrase next = reducePhrase(current);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
        return current;
    }

    private static int maxTag(Frame frame) {
        int tag = frame.tag();
        for (Frame kid : frame.kids()) {
            tag = Math.max(tag, maxTag(kid));
        }
        return tag;
    }

    // ==================== Frames ====================

    private Frame collapse(Frame frame) {
        if (frame instanceof ScalarFrame) {
            if (dialect.hasBooleanValues()) {
                return new NestedFrame(List.of(), List.of(), List.of(new TruePhrase(frame.term().space())),
                        null, List.of(), null, List.of(), null, null, frame.tag(), frame.term());
            }
            return frame;
        }
        if (frame instanceof BranchFrame branch) {
            return collapseBranch(branch);
        }
        return frame;
    }

    private BranchFrame collapseBranch(BranchFrame frame) {
        List<Anchor> include = new ArrayList<>(frame.include());
        Phrase where = frame.where();
        List<NestedFrame> embed = new ArrayList<>(frame.embed());
        List<Phrase> group = frame.group();
        Phrase having = frame.having();
        List<Phrase> order = frame.order();
        Integer limit = frame.limit();
        Integer offset = frame.offset();

        if (!include.isEmpty() && include.get(0).frame() instanceof ScalarFrame) {
            if (include.size() == 1) {
                if (dialect.hasBooleanValues()) {
                    include.clear();
                }
            } else if (include.get(1).isInner() || include.get(1).isCross()) {
                Anchor next = include.get(1);
                where = conjoin(where, next.condition(), frame);
                include.remove(0);
                include.set(0, new LeadingAnchor(next.frame()));
            }
        }

        for (int i = 0; i < include.size(); i++) {
            Anchor anchor = include.get(i);
            include.set(i, anchor.with(collapse(anchor.frame()), anchor.condition()));
        }

        if (!include.isEmpty() && include.get(0).frame() instanceof NestedFrame leading
                && isLeadingMergeable(leading, include, embed, where, group, having, order, limit, offset)) {
            remember(leading);
            List<Anchor> merged = new ArrayList<>(leading.include());
            merged.addAll(include.subList(1, include.size()));
            include = merged;
            List<NestedFrame> mergedEmbed = new ArrayList<>(embed);
            mergedEmbed.addAll(leading.embed());
            embed = mergedEmbed;
            where = conjoin(leading.where(), where, frame);
            if (leading.isSliced()) {
                order = leading.order();
                limit = leading.limit();
                offset = leading.offset();
            } else if (!leading.order().isEmpty() && order.isEmpty() && group.isEmpty()) {
                order = leading.order();
            }
            if (leading.isGrouped() || leading.isSliced()) {
                group = leading.group();
                having = leading.having();
            }
        }

        for (int i = 1; i < include.size(); i++) {
            Anchor anchor = include.get(i);
            if (anchor.frame() instanceof NestedFrame nested && isAnchorMergeable(anchor, nested)) {
                remember(nested);
                Phrase condition = conjoin(nested.where(), anchor.condition(), frame);
                include.set(i, anchor.with(nested.include().get(0).frame(), condition));
            }
        }

        if (!dialect.hasBooleanValues() && include.isEmpty()) {
            include.add(new LeadingAnchor(new ScalarFrame(++lastTag, frame.term())));
        }

        List<Anchor> reducedInclude = new ArrayList<>();
        for (Anchor anchor : include) {
            Phrase condition = anchor.condition() != null ? reducePhrase(anchor.condition()) : null;
            reducedInclude.add(anchor.with(anchor.frame(), condition));
        }
        List<NestedFrame> reducedEmbed = new ArrayList<>();
        for (NestedFrame nested : embed) {
            reducedEmbed.add((NestedFrame) collapse(nested));
        }
        List<Phrase> select = reducePhrases(frame.select());
        where = where != null ? reducePhrase(where) : null;
        if (where != null && Phrases.isTrue(where)) {
            where = null;
        }
        group = reducePhrases(group);
        having = having != null ? reducePhrase(having) : null;
        if (having != null && Phrases.isTrue(having)) {
            having = null;
        }
        order = reducePhrases(order);
        return frame.with(reducedInclude, reducedEmbed, select, where, group, having, order, limit, offset);
    }

    private static boolean isMergeable(NestedFrame frame) {
        if (frame.term() instanceof PermanentTerm) {
            return false;
        }
        if (frame.include().isEmpty()) {
            // A subquery without FROM only computes constants.
            return frame.embed().isEmpty() && frame.where() == null && !frame.isGrouped()
                    && frame.order().isEmpty() && !frame.isSliced();
        }
        return true;
    }

    private static boolean isLeadingMergeable(NestedFrame frame, List<Anchor> include,
                                              List<NestedFrame> embed, Phrase where, List<Phrase> group,
                                              Phrase having, List<Phrase> order, Integer limit, Integer offset) {
        if (!isMergeable(frame)) {
            return false;
        }
        if (frame.isGrouped() || frame.isSliced()) {
            if (include.size() != 1 || !embed.isEmpty() || where != null || !group.isEmpty() || having != null) {
                return false;
            }
            if (frame.isSliced() && (!order.isEmpty() || limit != null || offset != null)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isAnchorMergeable(Anchor anchor, NestedFrame frame) {
        if (!isMergeable(frame) || frame.include().size() != 1 || !frame.embed().isEmpty()
                || frame.isGrouped() || !frame.order().isEmpty() || frame.isSliced()) {
            return false;
        }
        if (anchor.isRight() && frame.where() != null) {
            return false;
        }
        if (anchor.isLeft() || anchor.isRight()) {
            for (Phrase phrase : frame.select()) {
                if (!(phrase instanceof ColumnPhrase) && !(phrase instanceof ReferencePhrase)) {
                    return false;
                }
            }
        }
        return true;
    }

    private void remember(NestedFrame frame) {
        for (int index = 0; index < frame.select().size(); index++) {
            substitutes.put(new Reference(frame.tag(), index), frame.select().get(index));
        }
    }

    private static Phrase conjoin(Phrase first, Phrase second, Frame frame) {
        if (first == null) {
            return second;
        }
        if (second == null) {
            return first;
        }
        return Phrases.and(List.of(first, second), frame.term().space());
    }

    // ==================== Phrases ====================

    private List<Phrase> reducePhrases(List<Phrase> phrases) {
        List<Phrase> reduced = new ArrayList<>(phrases.size());
        for (Phrase phrase : phrases) {
            reduced.add(reducePhrase(phrase));
        }
        return reduced;
    }

    private Phrase reducePhrase(Phrase phrase) {
        if (phrase instanceof ReferencePhrase reference) {
            Phrase substitute = substitutes.get(new Reference(reference.tag(), reference.index()));
            if (substitute == null) {
                return phrase;
            }
            substitute = reducePhrase(substitute);
            return reference.isNullable() ? substitute.withNullable(true) : substitute;
        }
        if (phrase instanceof LiteralPhrase literal) {
            if (!dialect.hasBooleanValues() && literal.domain() instanceof TextDomain
                    && "".equals(literal.value())) {
                return new NullPhrase(literal.domain(), literal.expression());
            }
            return literal;
        }
        if (phrase instanceof CastPhrase cast) {
            Phrase base = reducePhrase(cast.base());
            if (base.domain().equals(cast.domain())) {
                return base;
            }
            return cast.withBase(base);
        }
        if (phrase instanceof FormulaPhrase formula) {
            return reduceFormula(formula);
        }
        return phrase;
    }

    private Phrase reduceFormula(FormulaPhrase phrase) {
        Arguments<Phrase> arguments = phrase.arguments().map(this::reducePhrase);
        FormulaPhrase formula = phrase.withArguments(arguments, phrase.isNullable());
        Signature signature = formula.signature();
        switch (signature.kind()) {
            case TO_PREDICATE:
                return reducePredicateWrapper(formula, SignatureKind.FROM_PREDICATE);
            case FROM_PREDICATE:
                return reducePredicateWrapper(formula, SignatureKind.TO_PREDICATE);
            case AND:
            case OR:
                return reduceConnective(formula);
            case NOT:
                return reduceNegation(formula);
            case KEEP_POLARITY:
                return formula.get("op");
            case REVERSE_POLARITY:
                return reduceNegative(formula);
            case IF_NULL:
                return reduceIfNull(formula);
            case NULL_IF:
                return reduceNullIf(formula);
            case ADD:
            case SUBTRACT:
            case MULTIPLY:
                return reduceArithmetic(formula);
            case CONCATENATE:
                return reduceConcatenate(formula);
            default:
                return formula;
        }
    }

    private Phrase reducePredicateWrapper(FormulaPhrase formula, SignatureKind inverse) {
        Phrase op = formula.get("op");
        if (dialect.hasBooleanValues()) {
            return op;
        }
        if (Phrases.isFormula(op, inverse)) {
            return ((FormulaPhrase) op).get("op");
        }
        return formula.withArguments(formula.arguments(), op.isNullable());
    }

    private Phrase reduceConnective(FormulaPhrase formula) {
        boolean isAnd = formula.signature().kind() == SignatureKind.AND;
        List<Phrase> ops = new ArrayList<>();
        for (Phrase op : formula.arguments().list("ops")) {
            Boolean value = Phrases.booleanValue(op);
            if (value == null) {
                ops.add(op);
            } else if (value != isAnd) {
                return condition(!isAnd, formula);
            }
        }
        if (ops.isEmpty()) {
            return condition(isAnd, formula);
        }
        if (ops.size() == 1) {
            return ops.get(0);
        }
        boolean isNullable = ops.stream().anyMatch(Phrase::isNullable);
        return formula.withArguments(Arguments.<Phrase>builder().putList("ops", ops).build(), isNullable);
    }

    private Phrase reduceNegation(FormulaPhrase formula) {
        Boolean value = Phrases.booleanValue(formula.get("op"));
        if (value != null) {
            return condition(!value, formula);
        }
        return formula;
    }

    /**
     * Returns a constant in the position of a condition.
     */
    private Phrase condition(boolean value, Phrase origin) {
        LiteralPhrase literal = new LiteralPhrase(value, origin.domain(), origin.expression());
        if (dialect.hasBooleanValues()) {
            return literal;
        }
        return Phrases.toPredicate(literal);
    }

    private Phrase reduceNegative(FormulaPhrase formula) {
        Phrase op = formula.get("op");
        if (op instanceof LiteralPhrase literal) {
            if (literal.value() instanceof BigInteger value) {
                return new LiteralPhrase(value.negate(), formula.domain(), formula.expression());
            }
            if (literal.value() instanceof BigDecimal value) {
                return new LiteralPhrase(value.negate(), formula.domain(), formula.expression());
            }
        }
        return formula;
    }

    private Phrase reduceIfNull(FormulaPhrase formula) {
        Phrase lop = formula.get("lop");
        Phrase rop = formula.get("rop");
        if (!lop.isNullable() || (rop instanceof LiteralPhrase literal && literal.value() == null)) {
            return lop;
        }
        return formula;
    }

    private Phrase reduceNullIf(FormulaPhrase formula) {
        Phrase lop = formula.get("lop");
        Phrase rop = formula.get("rop");
        if (lop instanceof LiteralPhrase left && rop instanceof LiteralPhrase right) {
            if (left.value() == null || Objects.equals(left.value(), right.value())) {
                return new NullPhrase(formula.domain(), formula.expression());
            }
            return lop;
        }
        if (rop instanceof LiteralPhrase right && right.value() == null) {
            return lop;
        }
        return formula;
    }

    private Phrase reduceArithmetic(FormulaPhrase formula) {
        Phrase lop = formula.get("lop");
        Phrase rop = formula.get("rop");
        if (!(lop instanceof LiteralPhrase left) || !(rop instanceof LiteralPhrase right)) {
            return formula;
        }
        SignatureKind kind = formula.signature().kind();
        Object value = null;
        if (left.value() instanceof BigInteger l && right.value() instanceof BigInteger r) {
            value = kind == SignatureKind.ADD ? l.add(r) : kind == SignatureKind.SUBTRACT ? l.subtract(r) : l.multiply(r);
        } else if (left.value() instanceof BigDecimal l && right.value() instanceof BigDecimal r) {
            value = kind == SignatureKind.ADD ? l.add(r) : kind == SignatureKind.SUBTRACT ? l.subtract(r) : l.multiply(r);
        }
        if (value == null) {
            return formula;
        }
        return new LiteralPhrase(value, formula.domain(), formula.expression());
    }

    private Phrase reduceConcatenate(FormulaPhrase formula) {
        if (!dialect.hasBooleanValues()) {
            return formula;
        }
        Phrase lop = emptyIfNull(formula.get("lop"), formula);
        Phrase rop = emptyIfNull(formula.get("rop"), formula);
        return formula.withArguments(Arguments.<Phrase>builder().put("lop", lop).put("rop", rop).build(), false);
    }

    private static Phrase emptyIfNull(Phrase op, FormulaPhrase formula) {
        if (!op.isNullable()) {
            return op;
        }
        LiteralPhrase empty = new LiteralPhrase("", formula.domain(), formula.expression());
        return new FormulaPhrase(Signature.of(SignatureKind.IF_NULL), op.domain(), false,
                Arguments.<Phrase>builder().put("lop", op).put("rop", empty).build(), op.expression());
    }
}
