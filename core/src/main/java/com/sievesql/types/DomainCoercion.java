package com.sievesql.types;

import java.util.List;
import java.util.Optional;

/**
 * Determines the common domain of a list of values.
 *
 * <p>The binary rule is folded from the left over the list:
 * {@code coerce(a, b, c) = binary(binary(a, b), c)}; the result then goes
 * through the unary rule, which rejects structural domains and specializes
 * a still untyped result to text.
 *
 * <p>Binary rules are listed per ordered pair; a pair with no rule has no
 * common domain unless both domains are equal. Untyped values adopt the
 * domain they are paired with.
 */
public final class DomainCoercion {

    private DomainCoercion() {
        // Utility class
    }

    /**
     * Finds the common domain of the given domains.
     *
     * @param domains the domains to unify
     * @return the common domain, or empty if there is none
     */
    public static Optional<Domain> coerce(Domain... domains) {
        if (domains.length == 0) {
            return Optional.empty();
        }
        Domain domain = domains[0];
        for (int i = 1; i < domains.length && domain != null; i++) {
            domain = binary(domain, domains[i]);
        }
        if (domain == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(unary(domain));
    }

    /**
     * Finds the common domain of the given domains.
     *
     * @param domains the domains to unify
     * @return the common domain, or empty if there is none
     */
    public static Optional<Domain> coerce(List<Domain> domains) {
        return coerce(domains.toArray(new Domain[0]));
    }

    static Domain unary(Domain domain) {
        if (domain instanceof VoidDomain || domain instanceof ListDomain || domain instanceof RecordDomain
                || domain instanceof EntityDomain || domain instanceof IdentityDomain) {
            return null;
        }
        if (domain instanceof UntypedDomain) {
            return new TextDomain();
        }
        return domain;
    }

    static Domain binary(Domain left, Domain right) {
        boolean leftUntyped = left instanceof UntypedDomain;
        boolean rightUntyped = right instanceof UntypedDomain;

        if (is(left, right, BooleanDomain.class)) {
            return new BooleanDomain();
        }
        if (is(left, right, IntegerDomain.class)) {
            return new IntegerDomain();
        }
        if (isNumeric(left, right, DecimalDomain.class, IntegerDomain.class)) {
            return new DecimalDomain();
        }
        if (isNumeric(left, right, FloatDomain.class, DecimalDomain.class, IntegerDomain.class)) {
            return new FloatDomain();
        }
        if (is(left, right, TextDomain.class)) {
            return new TextDomain();
        }
        if (left instanceof EnumDomain || right instanceof EnumDomain) {
            if (leftUntyped) {
                return right;
            }
            if (rightUntyped) {
                return left;
            }
            return left.equals(right) ? left : null;
        }
        if (is(left, right, DateDomain.class)) {
            return new DateDomain();
        }
        if (is(left, right, TimeDomain.class)) {
            return new TimeDomain();
        }
        if (is(left, right, DateTimeDomain.class)) {
            return new DateTimeDomain();
        }
        return left.equals(right) ? left : null;
    }

    /**
     * Matches {@code (T, T)}, {@code (T, untyped)} and {@code (untyped, T)}.
     */
    private static boolean is(Domain left, Domain right, Class<? extends Domain> type) {
        return (type.isInstance(left) && (type.isInstance(right) || right instanceof UntypedDomain))
            || (left instanceof UntypedDomain && type.isInstance(right));
    }

    /**
     * Matches the pairs of {@link #is} for the widest numeric type, plus
     * pairs of the widest type with any of the narrower ones in either order.
     */
    @SafeVarargs
    private static boolean isNumeric(Domain left, Domain right, Class<? extends Domain> widest,
                                     Class<? extends Domain>... narrower) {
        if (is(left, right, widest)) {
            return true;
        }
        for (Class<? extends Domain> type : narrower) {
            if ((widest.isInstance(left) && type.isInstance(right))
                    || (type.isInstance(left) && widest.isInstance(right))) {
                return true;
            }
        }
        return false;
    }
}
