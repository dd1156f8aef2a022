package com.sievesql.binding;

import java.util.List;

/**
 * A name shared by several attributes.
 *
 * @param alternatives unambiguous names of the candidates, for the hint
 */
public record AmbiguousRecipe(List<String> alternatives) implements Recipe {

    public AmbiguousRecipe {
        alternatives = List.copyOf(alternatives);
    }
}
