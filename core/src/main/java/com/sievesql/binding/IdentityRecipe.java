package com.sievesql.binding;

import java.util.List;

public record IdentityRecipe(List<Recipe> elements) implements Recipe {

    public IdentityRecipe {
        elements = List.copyOf(elements);
    }
}
