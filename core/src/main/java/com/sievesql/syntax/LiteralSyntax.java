package com.sievesql.syntax;

import com.sievesql.mark.Mark;

import java.util.List;
import java.util.Objects;

/**
 * A string or number literal.
 */
public abstract class LiteralSyntax extends Syntax {

    private final String value;

    protected LiteralSyntax(String value, Mark mark) {
        super(mark);
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public String value() {
        return value;
    }

    @Override
    protected List<Object> basis() {
        return List.of(value);
    }
}
