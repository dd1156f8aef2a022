package com.sievesql.binding;

import com.sievesql.syntax.Syntax;

import java.util.List;

/**
 * A calculated attribute: the body is bound anew at every use, in the scope
 * the attribute was defined in.
 *
 * @param base the defining scope
 * @param terms the remaining names of a qualified definition
 * @param parameters the parameters, or null
 * @param body the definition body
 */
public record SubstitutionRecipe(Binding base, List<AssignmentBinding.Term> terms,
                                 List<AssignmentBinding.Term> parameters, Syntax body) implements Recipe {

    public SubstitutionRecipe {
        terms = List.copyOf(terms);
        parameters = parameters != null ? List.copyOf(parameters) : null;
    }
}
