package com.sievesql.syntax;

import com.sievesql.mark.Mark;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A function applied in the infix form {@code lbranch :name (rbranch, ...)}.
 */
public class MappingSyntax extends ApplicationSyntax {

    private final IdentifierSyntax identifier;
    private final Syntax lbranch;
    private final List<Syntax> rbranches;

    public MappingSyntax(IdentifierSyntax identifier, Syntax lbranch, List<Syntax> rbranches, Mark mark) {
        super(identifier.value(), prepend(lbranch, rbranches), mark);
        this.identifier = identifier;
        this.lbranch = lbranch;
        this.rbranches = List.copyOf(rbranches);
    }

    private static List<Syntax> prepend(Syntax lbranch, List<Syntax> rbranches) {
        List<Syntax> arguments = new ArrayList<>();
        arguments.add(Objects.requireNonNull(lbranch, "lbranch must not be null"));
        arguments.addAll(rbranches);
        return arguments;
    }

    public IdentifierSyntax identifier() {
        return identifier;
    }

    public Syntax lbranch() {
        return lbranch;
    }

    public List<Syntax> rbranches() {
        return rbranches;
    }

    @Override
    protected List<Object> basis() {
        return List.of(identifier, lbranch, rbranches);
    }

    protected String renderArguments() {
        if (rbranches.isEmpty()) {
            return "";
        }
        return rbranches.stream().map(Syntax::toString).collect(Collectors.joining(",", "(", ")"));
    }

    @Override
    public String toString() {
        return lbranch + ":" + identifier + renderArguments();
    }
}
