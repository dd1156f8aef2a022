package com.sievesql.binding;

import com.sievesql.types.Domain;

public record LiteralRecipe(Object value, Domain domain) implements Recipe {
}
