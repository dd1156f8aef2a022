package com.sievesql.generator;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Registry of the supported SQL dialects by name.
 */
public final class Dialects {

    private static final Map<String, Supplier<Dialect>> DIALECTS = new LinkedHashMap<>();

    static {
        DIALECTS.put(PostgresDialect.NAME, PostgresDialect::new);
        DIALECTS.put("pgsql", PostgresDialect::new);
        DIALECTS.put(OracleDialect.NAME, OracleDialect::new);
    }

    private Dialects() {
    }

    /**
     * Returns the dialect registered under a name (case-insensitive).
     *
     * @throws IllegalArgumentException if no dialect has that name
     */
    public static Dialect forName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Dialect name cannot be null; expected one of " + names());
        }
        Supplier<Dialect> factory = DIALECTS.get(name.trim().toLowerCase(Locale.ROOT));
        if (factory == null) {
            throw new IllegalArgumentException("Unknown dialect '" + name + "'; expected one of " + names());
        }
        return factory.get();
    }

    public static Set<String> names() {
        return DIALECTS.keySet();
    }
}
