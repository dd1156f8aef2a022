package com.sievesql.functions;

import java.util.List;
import java.util.Objects;

/**
 * The operation of a formula: its kind plus the few parameters some kinds
 * carry.
 *
 * <p>{@code polarity} is {@code +1} or {@code -1} for polar kinds
 * ({@code IS_EQUAL}, {@code IS_IN}, {@code IS_NULL}, {@code CONTAINS},
 * {@code LIKE}, {@code QUANTIFY}, {@code MIN_MAX}, {@code SORT_DIRECTION})
 * and {@code 0} otherwise. {@code relation} is one of {@code <}, {@code <=},
 * {@code >}, {@code >=} for {@code COMPARE} and null otherwise.
 *
 * @param kind the operation kind
 * @param polarity the polarity, or 0
 * @param relation the comparison relation, or null
 */
public record Signature(SignatureKind kind, int polarity, String relation) {

    public Signature {
        Objects.requireNonNull(kind, "kind must not be null");
        if (polarity < -1 || polarity > 1) {
            throw new IllegalArgumentException("polarity must be -1, 0 or +1; got " + polarity);
        }
    }

    public static Signature of(SignatureKind kind) {
        return new Signature(kind, 0, null);
    }

    public static Signature polar(SignatureKind kind, int polarity) {
        if (polarity != 1 && polarity != -1) {
            throw new IllegalArgumentException("polarity must be -1 or +1; got " + polarity);
        }
        return new Signature(kind, polarity, null);
    }

    public static Signature compare(String relation) {
        if (!List.of("<", "<=", ">", ">=").contains(relation)) {
            throw new IllegalArgumentException("unknown relation: " + relation);
        }
        return new Signature(SignatureKind.COMPARE, 0, relation);
    }

    public List<Slot> slots() {
        return kind.slots();
    }

    public boolean is(SignatureKind other) {
        return kind.isSubkindOf(other);
    }

    /**
     * Returns a signature of another kind keeping the parameters.
     */
    public Signature withKind(SignatureKind other) {
        return new Signature(other, polarity, relation);
    }

    /**
     * Returns the signature with the opposite polarity.
     */
    public Signature reverse() {
        return new Signature(kind, -polarity, relation);
    }

    @Override
    public String toString() {
        if (relation != null) {
            return kind + "(" + relation + ")";
        }
        if (polarity != 0) {
            return kind + (polarity > 0 ? "(+)" : "(-)");
        }
        return kind.toString();
    }
}
