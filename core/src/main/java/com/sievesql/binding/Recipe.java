package com.sievesql.binding;

/**
 * Instructions for producing a binding from a name, returned by name
 * lookup and interpreted by {@link BindingState#use}.
 */
public sealed interface Recipe
    permits LiteralRecipe, SelectionRecipe, FreeTableRecipe, AttachedTableRecipe, ColumnRecipe,
            KernelRecipe, ComplementRecipe, IdentityRecipe, SubstitutionRecipe, BindingRecipe,
            ClosedRecipe, PinnedRecipe, ChainRecipe, AmbiguousRecipe {
}
