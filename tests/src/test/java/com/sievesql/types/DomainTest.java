package com.sievesql.types;

import com.sievesql.test.TestBase;
import com.sievesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for literal conversion and domain coercion.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Domain Tests")
public class DomainTest extends TestBase {

    static Stream<Arguments> literalValues() {
        IdentityDomain department = new IdentityDomain(List.of(new TextDomain()));
        IdentityDomain course = new IdentityDomain(List.of(department, new IntegerDomain()));
        return Stream.of(
            Arguments.of(new IntegerDomain(), BigInteger.valueOf(-7)),
            Arguments.of(new IntegerDomain(), new BigInteger("9223372036854775807")),
            Arguments.of(new DecimalDomain(), new BigDecimal("1.50")),
            Arguments.of(new DecimalDomain(), new BigDecimal("1E+3")),
            Arguments.of(new DecimalDomain(), new BigDecimal("-0.001")),
            Arguments.of(new FloatDomain(), -0.0),
            Arguments.of(new FloatDomain(), 1.0E-10),
            Arguments.of(new FloatDomain(), 12345.5),
            Arguments.of(new DateDomain(), LocalDate.of(2010, 4, 15)),
            Arguments.of(new TimeDomain(), LocalTime.of(9, 5)),
            Arguments.of(new TimeDomain(), LocalTime.of(23, 59, 59, 123456000)),
            Arguments.of(new DateTimeDomain(), LocalDateTime.of(2010, 4, 15, 20, 13, 4, 500000000)),
            Arguments.of(new BooleanDomain(), Boolean.TRUE),
            Arguments.of(new BooleanDomain(), Boolean.FALSE),
            Arguments.of(new TextDomain(), "it's"),
            Arguments.of(new TextDomain(), ""),
            Arguments.of(new EnumDomain(List.of("old", "north", "south")), "north"),
            Arguments.of(course, List.of(List.of("mth"), BigInteger.valueOf(101))),
            Arguments.of(course, List.of(List.of("a b"), BigInteger.ONE)));
    }

    @ParameterizedTest(name = "{0}: {1}")
    @MethodSource("literalValues")
    @DisplayName("TC-TYPE-010: parsing a dumped value gives the value back")
    void testRoundTrip(Domain domain, Object value) {
        String literal = domain.dump(value);
        logData(domain.family(), literal);

        assertThat(domain.parse(literal)).isEqualTo(value);
    }

    @Nested
    @DisplayName("Literal conversion")
    class Literals {

        @Test
        @DisplayName("TC-TYPE-001: scalar literals parse to native values")
        void testParseScalars() {
            assertThat(new IntegerDomain().parse(" 42 ")).isEqualTo(BigInteger.valueOf(42));
            assertThat(new DecimalDomain().parse("1.50")).isEqualTo(new BigDecimal("1.50"));
            assertThat(new BooleanDomain().parse("true")).isEqualTo(Boolean.TRUE);
            assertThat(new DateDomain().parse("2010-04-15")).isEqualTo(LocalDate.of(2010, 4, 15));
            assertThat(new TextDomain().parse("x")).isEqualTo("x");
            assertThat(new IntegerDomain().parse(null)).isNull();
        }

        @Test
        @DisplayName("TC-TYPE-002: malformed literals are rejected")
        void testParseErrors() {
            assertThatThrownBy(() -> new IntegerDomain().parse("1.5"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("invalid integer literal");
            assertThatThrownBy(() -> new BooleanDomain().parse("yes"))
                .hasMessage("invalid Boolean literal: expected 'true' or 'false'; got 'yes'");
            assertThatThrownBy(() -> new DateDomain().parse("2010-02-30"))
                .hasMessageStartingWith("invalid date literal");
            assertThatThrownBy(() -> new EnumDomain(List.of("old", "new")).parse("mid"))
                .hasMessage("invalid enum literal: expected one of 'old', 'new'; got 'mid'");
        }

        @Test
        @DisplayName("TC-TYPE-003: text with NUL cannot be dumped")
        void testDumpText() {
            assertThat(new TextDomain().dump("ok")).isEqualTo("ok");
            assertThatThrownBy(() -> new TextDomain().dump("a\0b"))
                .hasMessage("text value contains a NUL character");
        }

        @Test
        @DisplayName("TC-TYPE-004: identity with a nested label")
        void testIdentity() {
            IdentityDomain department = new IdentityDomain(List.of(new TextDomain()));
            IdentityDomain course = new IdentityDomain(List.of(department, new IntegerDomain()));
            assertThat(course.arity()).isEqualTo(2);

            Object value = course.parse("mth.101");
            logData("identity", value);
            assertThat(value).isEqualTo(List.of(List.of("mth"), BigInteger.valueOf(101)));
            assertThat(course.dump(value)).isEqualTo("mth.101");
            assertThat(course.dump(List.of(List.of("a b"), BigInteger.ONE))).isEqualTo("'a b'.1");
        }

        @Test
        @DisplayName("TC-TYPE-005: ill-formed identity")
        void testIdentityErrors() {
            IdentityDomain identity = new IdentityDomain(List.of(new TextDomain(), new IntegerDomain()));

            assertThatThrownBy(() -> identity.parse("mth"))
                .hasMessage("ill-formed locator");
            assertThatThrownBy(() -> identity.parse("mth.1)"))
                .hasMessage("ill-formed locator");
        }
    }

    @Nested
    @DisplayName("Coercion")
    class Coercion {

        @Test
        @DisplayName("TC-TYPE-006: numeric domains widen")
        void testNumeric() {
            assertThat(DomainCoercion.coerce(new IntegerDomain(), new IntegerDomain()))
                .contains(new IntegerDomain());
            assertThat(DomainCoercion.coerce(new IntegerDomain(), new DecimalDomain()))
                .contains(new DecimalDomain());
            assertThat(DomainCoercion.coerce(new DecimalDomain(), new FloatDomain(), new IntegerDomain()))
                .contains(new FloatDomain());
        }

        @Test
        @DisplayName("TC-TYPE-007: untyped values adopt the other domain")
        void testUntyped() {
            assertThat(DomainCoercion.coerce(new UntypedDomain(), new DateDomain()))
                .contains(new DateDomain());
            assertThat(DomainCoercion.coerce(new UntypedDomain(), new UntypedDomain()))
                .contains(new TextDomain());
            EnumDomain campus = new EnumDomain(List.of("old", "north"));
            assertThat(DomainCoercion.coerce(campus, new UntypedDomain())).contains(campus);
        }

        @Test
        @DisplayName("TC-TYPE-008: incompatible domains have no common domain")
        void testIncompatible() {
            assertThat(DomainCoercion.coerce(new IntegerDomain(), new TextDomain())).isEmpty();
            assertThat(DomainCoercion.coerce(new DateDomain(), new TimeDomain())).isEmpty();
            assertThat(DomainCoercion.coerce(new ListDomain(new IntegerDomain()))).isEmpty();
            assertThat(DomainCoercion.coerce()).isEmpty();
        }

        @Test
        @DisplayName("TC-TYPE-009: coercion does not depend on the order")
        void testSymmetry() {
            List<Domain> domains = List.of(new BooleanDomain(), new IntegerDomain(), new DecimalDomain(),
                    new FloatDomain(), new TextDomain(), new EnumDomain(List.of("old")), new DateDomain(),
                    new TimeDomain(), new DateTimeDomain(), new UntypedDomain(), new OpaqueDomain("jsonb"));
            for (Domain left : domains) {
                for (Domain right : domains) {
                    assertThat(DomainCoercion.coerce(left, right))
                        .as("%s, %s", left, right)
                        .isEqualTo(DomainCoercion.coerce(right, left));
                }
            }
        }
    }
}
