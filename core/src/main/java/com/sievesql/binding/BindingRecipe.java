package com.sievesql.binding;

public record BindingRecipe(Binding binding) implements Recipe {
}
