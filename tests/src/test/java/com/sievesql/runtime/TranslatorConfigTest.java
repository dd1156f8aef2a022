package com.sievesql.runtime;

import com.sievesql.generator.OracleDialect;
import com.sievesql.test.TestBase;
import com.sievesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("TranslatorConfig Tests")
public class TranslatorConfigTest extends TestBase {

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @ParameterizedTest(name = "''{0}'' means no limit")
        @ValueSource(strings = {"", "  ", "none", "NONE", "0"})
        @DisplayName("TC-CFG-001: no row limit")
        void testNoLimit(String value) {
            assertThat(TranslatorConfig.parseRowLimit(value)).isNull();
        }

        @Test
        @DisplayName("TC-CFG-002: numeric row limit")
        void testLimit() {
            assertThat(TranslatorConfig.parseRowLimit(" 100 ")).isEqualTo(100);
            assertThat(TranslatorConfig.parseRowLimit(null)).isNull();
        }

        @ParameterizedTest
        @ValueSource(strings = {"-1", "ten", "1.5"})
        @DisplayName("TC-CFG-003: invalid row limit")
        void testInvalidLimit(String value) {
            assertThatThrownBy(() -> TranslatorConfig.parseRowLimit(value))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid row limit: '" + value + "'. Expected a non-negative integer or 'none'");
        }

        @Test
        @DisplayName("TC-CFG-004: flags and dialect names")
        void testFlagsAndDialects() {
            assertThat(TranslatorConfig.parseFlag("x", "on")).isTrue();
            assertThat(TranslatorConfig.parseFlag("x", " No ")).isFalse();
            assertThatThrownBy(() -> TranslatorConfig.parseFlag("sievesql.cache", "maybe"))
                .hasMessage("Invalid value for sievesql.cache: 'maybe'. Valid values: true, false");
            assertThat(TranslatorConfig.parseDialect("pgsql")).isEqualTo("postgresql");
            assertThatThrownBy(() -> TranslatorConfig.parseDialect("sqlite"))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Builder")
    class Builder {

        @Test
        @DisplayName("TC-CFG-005: defaults")
        void testDefaults() {
            TranslatorConfig config = TranslatorConfig.defaults();

            assertThat(config.dialectName()).isEqualTo(TranslatorConfig.DEFAULT_DIALECT);
            assertThat(config.rowLimit()).isNull();
            assertThat(config.cacheEnabled()).isTrue();
        }

        @Test
        @DisplayName("TC-CFG-006: builder values")
        void testBuilder() {
            TranslatorConfig config = TranslatorConfig.builder()
                .dialect("oracle")
                .rowLimit(50)
                .cacheEnabled(false)
                .build();
            logData("config", config);

            assertThat(config.dialect()).isInstanceOf(OracleDialect.class);
            assertThat(config.rowLimit()).isEqualTo(50);
            assertThat(config.cacheEnabled()).isFalse();
            assertThat(config.toBuilder().build()).isEqualTo(config);
            assertThat(config.toBuilder().rowLimit(0).build().rowLimit()).isNull();
            assertThatThrownBy(() -> TranslatorConfig.builder().rowLimit(-5))
                .hasMessage("rowLimit must be non-negative, got -5");
        }

        @Test
        @DisplayName("TC-CFG-007: system properties seed the builder")
        void testSystemProperties() {
            System.setProperty(TranslatorConfig.DIALECT_PROPERTY, "oracle");
            System.setProperty(TranslatorConfig.ROW_LIMIT_PROPERTY, "25");
            System.setProperty(TranslatorConfig.CACHE_PROPERTY, "off");
            try {
                TranslatorConfig config = TranslatorConfig.defaults();
                assertThat(config.dialectName()).isEqualTo("oracle");
                assertThat(config.rowLimit()).isEqualTo(25);
                assertThat(config.cacheEnabled()).isFalse();

                TranslatorConfig overridden = TranslatorConfig.builder().dialect("postgresql").build();
                assertThat(overridden.dialectName()).isEqualTo("postgresql");
                assertThat(overridden.rowLimit()).isEqualTo(25);
            } finally {
                System.clearProperty(TranslatorConfig.DIALECT_PROPERTY);
                System.clearProperty(TranslatorConfig.ROW_LIMIT_PROPERTY);
                System.clearProperty(TranslatorConfig.CACHE_PROPERTY);
            }
        }
    }
}
