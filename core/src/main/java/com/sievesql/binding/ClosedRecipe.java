package com.sievesql.binding;

/**
 * Wraps the result of the inner recipe in an {@link AliasBinding}.
 */
public record ClosedRecipe(Recipe recipe) implements Recipe {
}
