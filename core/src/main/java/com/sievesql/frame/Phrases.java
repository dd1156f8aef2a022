package com.sievesql.frame;

import com.sievesql.functions.Arguments;
import com.sievesql.functions.Signature;
import com.sievesql.functions.SignatureKind;
import com.sievesql.space.Expression;
import com.sievesql.types.BooleanDomain;

import java.util.List;

/**
 * Factory methods and predicates for phrases.
 *
 * <p>Boolean values and SQL conditions are different things on some
 * backends. A phrase producing a Boolean value is turned into a condition
 * by {@link #toPredicate} and back by {@link #fromPredicate}; backends with
 * a native Boolean type drop both wrappers when the tree is reduced.
 */
public final class Phrases {

    private Phrases() {
    }

    public static FormulaPhrase toPredicate(Phrase phrase) {
        return unary(SignatureKind.TO_PREDICATE, phrase);
    }

    public static FormulaPhrase fromPredicate(Phrase phrase) {
        return unary(SignatureKind.FROM_PREDICATE, phrase);
    }

    private static FormulaPhrase unary(SignatureKind kind, Phrase phrase) {
        return new FormulaPhrase(Signature.of(kind), phrase.domain(), phrase.isNullable(),
                Arguments.<Phrase>builder().put("op", phrase).build(), phrase.expression());
    }

    public static FormulaPhrase sortDirection(Phrase phrase, int direction, Expression expression) {
        return new FormulaPhrase(Signature.polar(SignatureKind.SORT_DIRECTION, direction), phrase.domain(),
                phrase.isNullable(), Arguments.<Phrase>builder().put("base", phrase).build(), expression);
    }

    public static FormulaPhrase isEqual(Phrase lop, Phrase rop, Expression expression) {
        return new FormulaPhrase(Signature.polar(SignatureKind.IS_EQUAL, 1), new BooleanDomain(),
                lop.isNullable() || rop.isNullable(),
                Arguments.<Phrase>builder().put("lop", lop).put("rop", rop).build(), expression);
    }

    /**
     * Returns the conjunction of the given conditions.
     */
    public static Phrase and(List<Phrase> ops, Expression expression) {
        if (ops.size() == 1) {
            return ops.get(0);
        }
        boolean isNullable = ops.stream().anyMatch(Phrase::isNullable);
        return new FormulaPhrase(Signature.of(SignatureKind.AND), new BooleanDomain(), isNullable,
                Arguments.<Phrase>builder().putList("ops", ops).build(), expression);
    }

    public static boolean isFormula(Phrase phrase, SignatureKind kind) {
        return phrase instanceof FormulaPhrase formula && formula.signature().is(kind);
    }

    /**
     * Returns the Boolean value of a constant condition, looking through
     * predicate wrappers, or null if the phrase is not constant.
     */
    public static Boolean booleanValue(Phrase phrase) {
        while (isFormula(phrase, SignatureKind.TO_PREDICATE) || isFormula(phrase, SignatureKind.FROM_PREDICATE)) {
            phrase = ((FormulaPhrase) phrase).get("op");
        }
        if (phrase instanceof LiteralPhrase literal && literal.value() instanceof Boolean value) {
            return value;
        }
        return null;
    }

    public static boolean isTrue(Phrase phrase) {
        return Boolean.TRUE.equals(booleanValue(phrase));
    }
}
