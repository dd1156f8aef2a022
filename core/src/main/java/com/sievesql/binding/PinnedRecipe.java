package com.sievesql.binding;

/**
 * Applies the inner recipe in a fixed scope.
 */
public record PinnedRecipe(Binding scope, Recipe recipe) implements Recipe {
}
