package com.sievesql.binding;

public record ComplementRecipe(QuotientBinding quotient) implements Recipe {
}
