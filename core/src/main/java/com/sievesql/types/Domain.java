package com.sievesql.types;

/**
 * Sealed interface for the value types of the query language.
 *
 * <p>Every expression of a query has a domain. Scalar domains know how to
 * convert between a literal string and a native Java value:
 * <ul>
 *   <li>{@link BooleanDomain}: {@code Boolean}</li>
 *   <li>{@link IntegerDomain}: {@code BigInteger}</li>
 *   <li>{@link DecimalDomain}: {@code BigDecimal}</li>
 *   <li>{@link FloatDomain}: {@code Double}</li>
 *   <li>{@link TextDomain}, {@link EnumDomain}, {@link OpaqueDomain}: {@code String}</li>
 *   <li>{@link DateDomain}, {@link TimeDomain}, {@link DateTimeDomain}:
 *       {@code LocalDate}, {@code LocalTime}, {@code LocalDateTime}</li>
 *   <li>{@link IdentityDomain}: {@code List<Object>}</li>
 * </ul>
 *
 * <p>Special domains ({@link VoidDomain}, {@link UntypedDomain},
 * {@link EntityDomain}, {@link RecordDomain}, {@link ListDomain}) describe
 * structural values and have no literal form. Untyped is the domain of a
 * literal whose type is not known yet.
 *
 * <p>Both {@link #parse} and {@link #dump} map null to null.
 */
public sealed interface Domain
    permits VoidDomain, UntypedDomain, BooleanDomain, IntegerDomain,
            DecimalDomain, FloatDomain, TextDomain, EnumDomain,
            DateDomain, TimeDomain, DateTimeDomain, IdentityDomain,
            RecordDomain, ListDomain, EntityDomain, OpaqueDomain {

    /**
     * Returns the name of the family of this domain, used in error messages.
     *
     * @return the family name, e.g. {@code "integer"}
     */
    String family();

    /**
     * Converts a literal string to a native value.
     *
     * @param data the literal, may be null
     * @return the native value, or null if {@code data} is null
     * @throws IllegalArgumentException if the literal is malformed
     */
    default Object parse(String data) {
        if (data == null) {
            return null;
        }
        throw new IllegalArgumentException("invalid literal");
    }

    /**
     * Converts a native value to its literal string.
     *
     * @param value the native value, may be null
     * @return the literal, or null if {@code value} is null
     * @throws IllegalArgumentException if the value does not belong to the domain
     */
    default String dump(Object value) {
        if (value == null) {
            return null;
        }
        throw new IllegalArgumentException("a value of type '" + family() + "' has no literal form");
    }
}
