package com.sievesql.syntax;

import com.sievesql.mark.Mark;

import java.util.List;
import java.util.Objects;

/**
 * A function call, a mapping or an operator: anything that is resolved
 * by the name of a function applied to a list of arguments.
 */
public abstract class ApplicationSyntax extends Syntax {

    private final String name;
    private final List<Syntax> arguments;

    protected ApplicationSyntax(String name, List<Syntax> arguments, Mark mark) {
        super(mark);
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.arguments = List.copyOf(arguments);
    }

    /**
     * Returns the name the application is resolved by; prefix and postfix
     * operators are named {@code op_} and {@code _op} respectively.
     */
    public String name() {
        return name;
    }

    public List<Syntax> arguments() {
        return arguments;
    }
}
