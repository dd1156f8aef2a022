package com.sievesql.binding;

import com.sievesql.syntax.Syntax;

/**
 * An element of an expansion: the syntax to bind it with and the recipe
 * that produces it.
 */
public record RecipeItem(Syntax syntax, Recipe recipe) {
}
