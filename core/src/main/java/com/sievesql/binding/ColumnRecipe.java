package com.sievesql.binding;

import com.sievesql.catalog.Column;

/**
 * @param column the column
 * @param link the recipe of the referred table scope, or null
 */
public record ColumnRecipe(Column column, Recipe link) implements Recipe {
}
