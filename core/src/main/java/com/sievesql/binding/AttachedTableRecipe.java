package com.sievesql.binding;

import com.sievesql.catalog.Join;

import java.util.List;

public record AttachedTableRecipe(List<Join> joins) implements Recipe {

    public AttachedTableRecipe {
        joins = List.copyOf(joins);
    }
}
