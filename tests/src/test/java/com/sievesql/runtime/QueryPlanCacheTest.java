package com.sievesql.runtime;

import com.sievesql.catalog.Catalog;
import com.sievesql.functions.FunctionRegistry;
import com.sievesql.test.TestBase;
import com.sievesql.test.TestCategories;
import com.sievesql.test.UniversityCatalog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("QueryPlanCache Tests")
public class QueryPlanCacheTest extends TestBase {

    private static final Catalog CATALOG = UniversityCatalog.catalog();
    private static final FunctionRegistry FUNCTIONS = FunctionRegistry.builtins();

    private static QueryPlanCache.Key key(String query) {
        return new QueryPlanCache.Key(query, "postgresql", null, CATALOG, FUNCTIONS);
    }

    private static CompiledSql result(String sql) {
        return new CompiledSql(sql, List.of(), List.of(), "default");
    }

    @Test
    @DisplayName("TC-CACHE-001: second lookup is a hit")
    void testHit() {
        QueryPlanCache cache = new QueryPlanCache();
        QueryPlanCache.Key key = key("/school");
        AtomicInteger calls = new AtomicInteger();

        CompiledSql first = cache.get(key, k -> {
            calls.incrementAndGet();
            return result("SELECT 1\n");
        });
        CompiledSql second = cache.get(key, k -> {
            calls.incrementAndGet();
            return result("SELECT 2\n");
        });

        assertThat(second).isSameAs(first);
        assertThat(calls).hasValue(1);
        assertThat(cache.hits()).isEqualTo(1);
        assertThat(cache.misses()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("TC-CACHE-002: dialect and row limit are part of the key")
    void testKey() {
        TranslatorConfig pg = TranslatorConfig.builder().dialect("postgresql").build();
        RootScope scope = new RootScope(CATALOG, FUNCTIONS, pg);

        assertThat(QueryPlanCache.Key.of("/school", scope))
            .isEqualTo(key("/school"))
            .isNotEqualTo(QueryPlanCache.Key.of("/school",
                scope.withConfig(pg.toBuilder().rowLimit(10).build())))
            .isNotEqualTo(QueryPlanCache.Key.of("/school",
                scope.withConfig(pg.toBuilder().dialect("oracle").build())));
    }

    @Test
    @DisplayName("TC-CACHE-004: catalog and functions are part of the key")
    void testScopeKey() {
        RootScope scope = new RootScope(CATALOG, FUNCTIONS, TranslatorConfig.defaults());
        RootScope otherCatalog = new RootScope(UniversityCatalog.catalog(), FUNCTIONS, TranslatorConfig.defaults());
        RootScope otherFunctions = new RootScope(CATALOG, FunctionRegistry.builtins(), TranslatorConfig.defaults());

        assertThat(QueryPlanCache.Key.of("/school", scope))
            .isEqualTo(QueryPlanCache.Key.of("/school", scope.withConfig(TranslatorConfig.defaults())))
            .isNotEqualTo(QueryPlanCache.Key.of("/school", otherCatalog))
            .isNotEqualTo(QueryPlanCache.Key.of("/school", otherFunctions));
        assertThat(QueryPlanCache.Key.of("/school", scope).toString()).contains("/school").doesNotContain("Catalog@");
    }

    @Test
    @DisplayName("TC-CACHE-003: failures are not cached")
    void testFailure() {
        QueryPlanCache cache = new QueryPlanCache();
        QueryPlanCache.Key key = key("/bad");

        assertThatThrownBy(() -> cache.get(key, k -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(cache.size()).isZero();
        assertThat(cache.get(key, k -> result(null)).hasSql()).isFalse();

        cache.clear();
        assertThat(cache.size()).isZero();
    }
}
