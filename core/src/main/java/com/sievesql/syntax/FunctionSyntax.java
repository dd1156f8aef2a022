package com.sievesql.syntax;

import com.sievesql.mark.Mark;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A function call {@code name(branch, ...)}.
 */
public final class FunctionSyntax extends ApplicationSyntax {

    private final IdentifierSyntax identifier;
    private final List<Syntax> branches;

    public FunctionSyntax(IdentifierSyntax identifier, List<Syntax> branches, Mark mark) {
        super(identifier.value(), branches, mark);
        this.identifier = identifier;
        this.branches = List.copyOf(branches);
    }

    public IdentifierSyntax identifier() {
        return identifier;
    }

    public List<Syntax> branches() {
        return branches;
    }

    @Override
    protected List<Object> basis() {
        return List.of(identifier, branches);
    }

    @Override
    public String toString() {
        return identifier + branches.stream().map(Syntax::toString).collect(Collectors.joining(",", "(", ")"));
    }
}
