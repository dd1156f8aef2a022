package com.sievesql.space;

import com.sievesql.binding.Binding;
import com.sievesql.functions.Arguments;
import com.sievesql.functions.Signature;
import com.sievesql.functions.SignatureKind;
import com.sievesql.types.BooleanDomain;
import com.sievesql.types.Domain;
import com.sievesql.types.IntegerDomain;

import java.math.BigInteger;
import java.util.List;

/**
 * Factory methods for the codes the encoder and the compiler synthesize.
 */
public final class Codes {

    private Codes() {
    }

    public static LiteralCode literal(Object value, Domain domain, Binding binding) {
        return new LiteralCode(value, domain, binding);
    }

    public static LiteralCode bool(boolean value, Binding binding) {
        return new LiteralCode(value, new BooleanDomain(), binding);
    }

    public static LiteralCode integer(long value, Binding binding) {
        return new LiteralCode(BigInteger.valueOf(value), new IntegerDomain(), binding);
    }

    public static FormulaCode unary(Signature signature, Domain domain, Code op, Binding binding) {
        return new FormulaCode(signature, domain, Arguments.<Code>builder().put("op", op).build(), binding);
    }

    public static FormulaCode binary(Signature signature, Domain domain, Code lop, Code rop, Binding binding) {
        return new FormulaCode(signature, domain,
                Arguments.<Code>builder().put("lop", lop).put("rop", rop).build(), binding);
    }

    public static FormulaCode isNotNull(Code op, Binding binding) {
        return unary(Signature.polar(SignatureKind.IS_NULL, -1), new BooleanDomain(), op, binding);
    }

    public static FormulaCode isEqual(Code lop, Code rop, Binding binding) {
        return binary(Signature.polar(SignatureKind.IS_EQUAL, 1), new BooleanDomain(), lop, rop, binding);
    }

    public static FormulaCode not(Code op, Binding binding) {
        return unary(Signature.of(SignatureKind.NOT), new BooleanDomain(), op, binding);
    }

    public static FormulaCode ifNull(Code lop, Code rop, Binding binding) {
        return binary(Signature.of(SignatureKind.IF_NULL), lop.domain(), lop, rop, binding);
    }

    public static FormulaCode compare(String relation, Code lop, Code rop, Binding binding) {
        return binary(Signature.compare(relation), new BooleanDomain(), lop, rop, binding);
    }

    public static FormulaCode add(Code lop, Code rop, Binding binding) {
        return binary(Signature.of(SignatureKind.ADD), lop.domain(), lop, rop, binding);
    }

    public static FormulaCode subtract(Code lop, Code rop, Binding binding) {
        return binary(Signature.of(SignatureKind.SUBTRACT), lop.domain(), lop, rop, binding);
    }

    /**
     * Returns the only operand, or their conjunction.
     */
    public static Code and(List<Code> ops, Binding binding) {
        if (ops.size() == 1) {
            return ops.get(0);
        }
        return new FormulaCode(Signature.of(SignatureKind.AND), new BooleanDomain(),
                Arguments.<Code>builder().putList("ops", ops).build(), binding);
    }

    /**
     * Builds {@code IF(predicate, consequent, alternative)}.
     */
    public static FormulaCode choose(Code predicate, Code consequent, Code alternative, Binding binding) {
        return new FormulaCode(Signature.of(SignatureKind.IF), consequent.domain(),
                Arguments.<Code>builder()
                    .putList("predicates", List.of(predicate))
                    .putList("consequents", List.of(consequent))
                    .put("alternative", alternative)
                    .build(), binding);
    }

    public static boolean isTrue(Code code) {
        return code instanceof LiteralCode literal && Boolean.TRUE.equals(literal.value());
    }

    /**
     * Returns the integer value of a literal, or null if the code is not an
     * integer literal or the literal is null.
     */
    public static BigInteger integerValue(Code code) {
        if (code instanceof LiteralCode literal && literal.value() instanceof BigInteger value) {
            return value;
        }
        return null;
    }
}
