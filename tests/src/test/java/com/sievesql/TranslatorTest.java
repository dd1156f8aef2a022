package com.sievesql;

import com.sievesql.catalog.Catalog;
import com.sievesql.catalog.CatalogBuilder;
import com.sievesql.exception.BindError;
import com.sievesql.exception.ParseError;
import com.sievesql.exception.TranslateError;
import com.sievesql.runtime.CompiledSql;
import com.sievesql.runtime.OutputColumn;
import com.sievesql.runtime.RootScope;
import com.sievesql.runtime.TranslatorConfig;
import com.sievesql.test.TestBase;
import com.sievesql.test.TestCategories;
import com.sievesql.test.UniversityCatalog;
import com.sievesql.types.IntegerDomain;
import com.sievesql.types.TextDomain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end translation tests against the university catalog.
 */
@TestCategories.Tier2
@TestCategories.Integration
@DisplayName("Translator Tests")
public class TranslatorTest extends TestBase {

    private Translator translator;
    private RootScope postgres;
    private RootScope oracle;

    @BeforeEach
    void setUp() {
        translator = new Translator();
        postgres = RootScope.of(UniversityCatalog.catalog())
            .withConfig(TranslatorConfig.builder().dialect("postgresql").build());
        oracle = postgres.withConfig(TranslatorConfig.builder().dialect("oracle").build());
    }

    private String sql(String query, RootScope scope) {
        CompiledSql result = translator.translate(query, scope);
        logData(query, result.sql());
        return result.sql();
    }

    @Nested
    @DisplayName("Scalar queries")
    class Scalars {

        @Test
        @DisplayName("TC-TR-001: constant arithmetic is folded")
        void testAddition() {
            CompiledSql result = translator.translate("/{1+1}", postgres);

            assertThat(result.sql()).isEqualTo("SELECT 2\n");
            assertThat(result.outputShape()).hasSize(1);
            assertThat(result.outputShape().get(0).domain()).isEqualTo(new IntegerDomain());
        }

        @Test
        @DisplayName("TC-TR-002: Oracle reads constants from DUAL")
        void testOracleDual() {
            String sql = sql("/{1+1}", oracle);

            assertThat(sql).contains("FROM DUAL").doesNotContain("DUAL \"");
        }

        @Test
        @DisplayName("TC-TR-003: text addition is concatenation")
        void testConcatenation() {
            assertThat(sql("/{'a'+'b'}", postgres)).contains("||");
        }

        @Test
        @DisplayName("TC-TR-004: Oracle renders Boolean values as numbers")
        void testBooleanValue() {
            assertThat(sql("/{true}", postgres)).isEqualTo("SELECT TRUE\n");
            assertThat(sql("/{false}", postgres)).isEqualTo("SELECT FALSE\n");
            assertThat(sql("/{false}", oracle)).contains("SELECT 0", "FROM DUAL").doesNotContain("FALSE");
        }

        @Test
        @DisplayName("TC-TR-018: string literal is selected as text")
        void testStringLiteral() {
            CompiledSql result = translator.translate("/{'abc'}", postgres);
            logData("sql", result.sql());

            assertThat(result.sql()).isEqualTo("SELECT 'abc'\n");
            assertThat(result.outputShape()).hasSize(1);
            assertThat(result.outputShape().get(0).domain()).isEqualTo(new TextDomain());
            assertThat(sql("/{'abc'}", oracle)).contains("SELECT 'abc'", "FROM DUAL");
        }

        @Test
        @DisplayName("TC-TR-019: integer division is done on NUMERIC values")
        void testDecimalDivision() {
            String sql = sql("/{3/2}", postgres);

            assertThat(sql).contains("3::NUMERIC", "2::NUMERIC");
            assertThat(sql("/{decimal('-1.5')}", postgres)).contains("'-1.5'::NUMERIC");
        }

        @Test
        @DisplayName("TC-TR-020: sorting by a constant needs no subquery")
        void testConstantSort() {
            assertThat(sql("/{1+}", postgres)).isEqualTo("SELECT 1\n");
            assertThat(sql("/{1+}", oracle)).contains("FROM DUAL").doesNotContain("(SELECT");
        }
    }

    @Nested
    @DisplayName("Table queries")
    class Tables {

        @Test
        @DisplayName("TC-TR-005: table reads its public columns")
        void testTable() {
            CompiledSql result = translator.translate("/school", postgres);
            logData("sql", result.sql());

            assertThat(result.sql()).contains("\"school\".\"code\"", "\"school\".\"name\"", "FROM \"school\"");
            assertThat(result.outputShape()).extracting(OutputColumn::title)
                .containsExactly("code", "name", "campus");
            assertThat(result.sql()).endsWith("\n");
        }

        @Test
        @DisplayName("TC-TR-006: sieve becomes a WHERE clause")
        void testSieve() {
            String sql = sql("/school?campus='old'", postgres);

            assertThat(sql).contains("WHERE", "'old'");
        }

        @Test
        @DisplayName("TC-TR-007: descending sort direction")
        void testSort() {
            String sql = sql("/school{name-}", postgres);

            assertThat(sql).contains("ORDER BY", "DESC");
        }

        @Test
        @DisplayName("TC-TR-008: aggregate of a plural link is grouped")
        void testCount() {
            String sql = sql("/department{name, count(course)}", postgres);

            assertThat(sql).contains("COUNT(", "GROUP BY");
        }

        @Test
        @DisplayName("TC-TR-009: Oracle slices rows with ROWNUM")
        void testOracleLimit() {
            String sql = sql("/school.limit(5,10)", oracle);

            assertThat(sql).doesNotContain("LIMIT").doesNotContain("OFFSET");
            int order = sql.indexOf("ORDER BY");
            int upper = sql.indexOf("(ROWNUM < 16)");
            int lower = sql.indexOf(" >= 11)");
            assertThat(order).isPositive();
            assertThat(upper).isGreaterThan(order);
            assertThat(lower).isGreaterThan(upper);
        }

        @Test
        @DisplayName("TC-TR-021: a filter after a slice applies to the sliced rows")
        void testOracleFilterAfterLimit() {
            String sql = sql("/school.limit(3,2){code,name}?code='a'", oracle);

            int upper = sql.indexOf("(ROWNUM < 6)");
            int lower = sql.indexOf(" >= 3)");
            int filter = sql.indexOf("'a'");
            assertThat(upper).isPositive();
            assertThat(lower).isGreaterThan(upper);
            assertThat(filter).isGreaterThan(upper);
        }

        @Test
        @DisplayName("TC-TR-022: Oracle table query reads no DUAL")
        void testOracleTable() {
            String sql = sql("/school", oracle);

            assertThat(sql).contains("FROM \"school\"").doesNotContain("DUAL");
        }

        @Test
        @DisplayName("TC-TR-023: nullable sort keys put NULLs first")
        void testNullsOrder() {
            assertThat(sql("/school{campus+}", postgres)).contains("ORDER BY 1 ASC NULLS FIRST");
            assertThat(sql("/school{campus-}", postgres)).contains("ORDER BY 1 DESC NULLS LAST");
            assertThat(sql("/school{campus+}", oracle)).contains("ORDER BY 1 ASC NULLS FIRST");
            assertThat(sql("/school{name+}", postgres)).contains("ORDER BY 1 ASC").doesNotContain("NULLS");
        }

        @Test
        @DisplayName("TC-TR-024: literal columns are selected")
        void testLiteralColumn() {
            CompiledSql result = translator.translate("/school{name, 'x'}", postgres);
            logData("sql", result.sql());

            assertThat(result.sql()).contains("\"school\".\"name\", 'x'");
            assertThat(result.outputShape()).hasSize(2);
            assertThat(result.outputShape().get(1).domain()).isEqualTo(new TextDomain());
        }

        @Test
        @DisplayName("TC-TR-010: row limit caps the output")
        void testRowLimit() {
            RootScope limited = postgres.withConfig(postgres.config().toBuilder().rowLimit(10).build());

            assertThat(sql("/school", limited)).contains("LIMIT 10");
        }

        @Test
        @DisplayName("TC-TR-011: output format command")
        void testFormat() {
            CompiledSql result = translator.translate("/school/:json", postgres);

            assertThat(result.format()).isEqualTo("json");
            assertThat(result.hasSql()).isTrue();
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("TC-TR-012: unknown attribute")
        void testUnknownAttribute() {
            BindError error = catchThrowableOfType(
                () -> translator.translate("/{nosuchcolumn}", postgres), BindError.class);

            assertThat(error).isNotNull();
            assertThat(error.mark().text()).isEqualTo("nosuchcolumn");
            assertThat(error.getUserMessage()).contains("While translating:");
        }

        @Test
        @DisplayName("TC-TR-013: incompatible operand types")
        void testIncompatibleTypes() {
            assertThatThrownBy(() -> translator.translate("/{1 + 'text'}", postgres))
                .isInstanceOf(BindError.class)
                .hasMessageContaining("'integer'")
                .hasMessageContaining("'untyped'");
        }

        @Test
        @DisplayName("TC-TR-014: syntax errors surface as parse errors")
        void testParseError() {
            assertThatThrownBy(() -> translator.translate("school", postgres))
                .isInstanceOf(ParseError.class)
                .isInstanceOf(TranslateError.class);
        }
    }

    @Nested
    @DisplayName("Caching")
    class Caching {

        @Test
        @DisplayName("TC-TR-015: repeated query is served from the cache")
        void testCached() {
            CompiledSql first = translator.translate("/school", postgres);
            CompiledSql second = translator.translate("/school", postgres);

            assertThat(second).isSameAs(first);
            assertThat(translator.cache().hits()).isEqualTo(1);
            assertThat(translator.cache().misses()).isEqualTo(1);
        }

        @Test
        @DisplayName("TC-TR-016: dialects are cached separately")
        void testDialectKey() {
            String pg = translator.translate("/{1+1}", postgres).sql();
            String ora = translator.translate("/{1+1}", oracle).sql();

            assertThat(pg).isNotEqualTo(ora);
            assertThat(translator.cache().size()).isEqualTo(2);
        }

        @Test
        @DisplayName("TC-TR-025: another catalog is not served from the cache")
        void testCatalogKey() {
            CatalogBuilder builder = new CatalogBuilder();
            builder.table("school")
                .column("id", new IntegerDomain(), false)
                .primaryKey("id");
            Catalog other = builder.build();
            RootScope otherScope = RootScope.of(other).withConfig(postgres.config());

            String first = translator.translate("/school", postgres).sql();
            CompiledSql second = translator.translate("/school", otherScope);
            logData("sql", second.sql());

            assertThat(first).contains("\"campus\"");
            assertThat(second.sql()).contains("\"id\"").doesNotContain("\"campus\"");
            assertThat(second.outputShape()).extracting(OutputColumn::title).containsExactly("id");
            assertThat(translator.cache().size()).isEqualTo(2);
        }

        @Test
        @DisplayName("TC-TR-017: disabled cache translates every time")
        void testDisabled() {
            RootScope uncached = postgres.withConfig(postgres.config().toBuilder().cacheEnabled(false).build());

            CompiledSql first = translator.translate("/school", uncached);
            CompiledSql second = translator.translate("/school", uncached);

            assertThat(second).isNotSameAs(first).isEqualTo(first);
            assertThat(translator.cache().size()).isZero();
        }
    }
}
