package com.sievesql.runtime;

import com.sievesql.catalog.Catalog;
import com.sievesql.functions.FunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Thread-safe cache of translated queries.
 *
 * <p>Entries are keyed by the query text, the dialect name, the row-limit
 * ceiling and the catalog and function registry the query was bound
 * against. Catalogs and registries are compared by identity. A query is translated at most once per key even when
 * several threads request it at the same time.
 */
public final class QueryPlanCache {

    private static final Logger logger = LoggerFactory.getLogger(QueryPlanCache.class);

    /**
     * The cache key.
     */
    public record Key(String query, String dialect, Integer rowLimit, Catalog catalog, FunctionRegistry functions) {

        public Key {
            Objects.requireNonNull(query, "query must not be null");
            Objects.requireNonNull(dialect, "dialect must not be null");
            Objects.requireNonNull(catalog, "catalog must not be null");
            Objects.requireNonNull(functions, "functions must not be null");
        }

        public static Key of(String query, RootScope scope) {
            TranslatorConfig config = scope.config();
            return new Key(query, config.dialectName(), config.rowLimit(), scope.catalog(), scope.functions());
        }

        @Override
        public String toString() {
            return "Key[query=" + query + ", dialect=" + dialect + ", rowLimit=" + rowLimit + "]";
        }
    }

    private final Map<Key, CompiledSql> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * Returns the cached translation for a key, computing it on a miss.
     * A failed translation is not cached.
     */
    public CompiledSql get(Key key, Function<Key, CompiledSql> translation) {
        Objects.requireNonNull(key, "key must not be null");
        CompiledSql cached = entries.get(key);
        if (cached != null) {
            hits.incrementAndGet();
            logger.debug("Query cache hit: {}", key);
            return cached;
        }
        return entries.computeIfAbsent(key, k -> {
            misses.incrementAndGet();
            logger.debug("Query cache miss: {}", k);
            return translation.apply(k);
        });
    }

    public int size() {
        return entries.size();
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    public void clear() {
        entries.clear();
        logger.debug("Query cache cleared");
    }
}
