package com.sievesql.generator;

import com.sievesql.test.TestBase;
import com.sievesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for alias assignment and dialect lookup.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Serializer Tests")
public class SerializerTest extends TestBase {

    @Nested
    @DisplayName("Aliases")
    class Aliases {

        @Test
        @DisplayName("TC-SER-001: unique names are kept")
        void testUnique() {
            Serializer serializer = new Serializer(new PostgresDialect());

            assertThat(serializer.namesToAliases(List.of("code", "name"), new HashSet<>()))
                .containsExactly("code", "name");
        }

        @Test
        @DisplayName("TC-SER-002: repeated names are numbered")
        void testRepeated() {
            Serializer serializer = new Serializer(new PostgresDialect());

            assertThat(serializer.namesToAliases(List.of("code", "code", "name"), new HashSet<>()))
                .containsExactly("code_1", "code_2", "name");
        }

        @Test
        @DisplayName("TC-SER-003: taken aliases are skipped")
        void testTaken() {
            Serializer serializer = new Serializer(new PostgresDialect());
            Set<String> taken = new HashSet<>(Set.of("code", "code_1"));

            List<String> aliases = serializer.namesToAliases(List.of("code", "code"), taken);

            assertThat(aliases).containsExactly("code_2", "code_3");
            assertThat(taken).contains("code_2", "code_3");
        }

        @Test
        @DisplayName("TC-SER-004: aliases fit the dialect limit")
        void testTruncated() {
            Serializer serializer = new Serializer(new OracleDialect());
            String name = "a".repeat(40);

            List<String> aliases = serializer.namesToAliases(List.of(name, name), new HashSet<>());

            assertThat(aliases).containsExactly("a".repeat(28) + "_1", "a".repeat(28) + "_2");
            assertThat(serializer.namesToAliases(List.of(name), new HashSet<>()).get(0)).hasSize(30);
        }
    }

    @Nested
    @DisplayName("Dialects")
    class DialectLookup {

        @Test
        @DisplayName("TC-SER-005: dialects are found by name or alias")
        void testForName() {
            assertThat(Dialects.forName("postgresql")).isInstanceOf(PostgresDialect.class);
            assertThat(Dialects.forName(" PGSQL ")).isInstanceOf(PostgresDialect.class);
            assertThat(Dialects.forName("Oracle")).isInstanceOf(OracleDialect.class);
            assertThat(Dialects.names()).containsExactly("postgresql", "pgsql", "oracle");
        }

        @Test
        @DisplayName("TC-SER-006: unknown dialect lists the known ones")
        void testUnknown() {
            assertThatThrownBy(() -> Dialects.forName("mysql"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown dialect 'mysql'; expected one of [postgresql, pgsql, oracle]");
        }

        @Test
        @DisplayName("TC-SER-007: Oracle has no Boolean values and short aliases")
        void testOracleTraits() {
            Dialect oracle = Dialects.forName("oracle");

            assertThat(oracle.hasBooleanValues()).isFalse();
            assertThat(oracle.maxAliasLength()).isEqualTo(30);
            assertThat(Dialects.forName("postgresql").hasBooleanValues()).isTrue();
        }
    }
}
