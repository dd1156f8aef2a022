package com.sievesql.binding;

import com.sievesql.catalog.Table;

public record FreeTableRecipe(Table table) implements Recipe {
}
