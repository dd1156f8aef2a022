package com.sievesql.binding;

import java.util.List;

/**
 * Applies recipes one after another, each in the scope produced by the
 * previous one.
 */
public record ChainRecipe(List<Recipe> recipes) implements Recipe {

    public ChainRecipe {
        recipes = List.copyOf(recipes);
    }
}
