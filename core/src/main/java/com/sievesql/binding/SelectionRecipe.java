package com.sievesql.binding;

import java.util.List;

public record SelectionRecipe(List<Recipe> recipes) implements Recipe {

    public SelectionRecipe {
        recipes = List.copyOf(recipes);
    }
}
