package com.sievesql.binding;

public record KernelRecipe(QuotientBinding quotient, int index) implements Recipe {
}
