package com.sievesql.runtime;

import com.sievesql.catalog.Catalog;
import com.sievesql.functions.FunctionRegistry;

import java.util.Objects;

/**
 * Everything a translation reads besides the query text: the database
 * catalog, the function registry and the translator settings.
 *
 * @param catalog the database catalog
 * @param functions the functions visible to queries
 * @param config the translator settings
 */
public record RootScope(Catalog catalog, FunctionRegistry functions, TranslatorConfig config) {

    public RootScope {
        Objects.requireNonNull(catalog, "catalog must not be null");
        Objects.requireNonNull(functions, "functions must not be null");
        Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Creates a scope with the built-in functions and the default settings.
     */
    public static RootScope of(Catalog catalog) {
        return new RootScope(catalog, FunctionRegistry.builtins(), TranslatorConfig.defaults());
    }

    public RootScope withConfig(TranslatorConfig config) {
        return new RootScope(catalog, functions, config);
    }
}
