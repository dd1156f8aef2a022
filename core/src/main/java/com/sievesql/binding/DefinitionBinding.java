package com.sievesql.binding;

import com.sievesql.syntax.Syntax;

/**
 * Adds a calculated attribute or a reference to the scope of the base.
 */
public final class DefinitionBinding extends WrappingBinding {

    private final String name;
    private final boolean isReference;
    private final Integer arity;
    private final Recipe recipe;

    public DefinitionBinding(Binding base, String name, boolean isReference, Integer arity, Recipe recipe,
                             Syntax syntax) {
        super(base, syntax);
        this.name = name;
        this.isReference = isReference;
        this.arity = arity;
        this.recipe = recipe;
    }

    public String name() {
        return name;
    }

    public boolean isReference() {
        return isReference;
    }

    /**
     * Returns the number of parameters, or null for a plain attribute.
     */
    public Integer arity() {
        return arity;
    }

    public Recipe recipe() {
        return recipe;
    }
}
