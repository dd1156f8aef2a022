package com.sievesql.syntax;

import com.sievesql.mark.Mark;

import java.util.List;
import java.util.Objects;

/**
 * A reference {@code $name}.
 */
public final class ReferenceSyntax extends Syntax {

    private final IdentifierSyntax identifier;

    public ReferenceSyntax(IdentifierSyntax identifier, Mark mark) {
        super(mark);
        this.identifier = Objects.requireNonNull(identifier, "identifier must not be null");
    }

    public IdentifierSyntax identifier() {
        return identifier;
    }

    @Override
    protected List<Object> basis() {
        return List.of(identifier);
    }

    @Override
    public String toString() {
        return "$" + identifier;
    }
}
