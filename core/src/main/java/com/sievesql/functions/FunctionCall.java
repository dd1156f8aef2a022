package com.sievesql.functions;

import com.sievesql.binding.BindingState;
import com.sievesql.mark.Mark;
import com.sievesql.syntax.Syntax;

import java.util.List;
import java.util.Objects;

/**
 * One application of a function by name, as handed to a {@link FunctionBinder}.
 *
 * @param state the binding state
 * @param syntax the application, or the bare identifier of a nullary call
 * @param name the name the function was found by
 * @param arguments the argument nodes, or null for a bare identifier
 */
public record FunctionCall(BindingState state, Syntax syntax, String name, List<Syntax> arguments) {

    public FunctionCall {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(syntax, "syntax must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }

    public Mark mark() {
        return syntax.mark();
    }

    /**
     * Returns the arguments, treating a bare identifier as an empty call.
     */
    public List<Syntax> operands() {
        return arguments != null ? arguments : List.of();
    }
}
