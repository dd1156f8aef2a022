package com.sievesql.syntax;

import com.sievesql.mark.Mark;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * An infix, prefix or postfix operator.
 *
 * <p>A prefix operator has no left branch and is named {@code symbol_};
 * a postfix operator has no right branch and is named {@code _symbol}.
 */
public class OperatorSyntax extends ApplicationSyntax {

    private final String symbol;
    private final Syntax lbranch;
    private final Syntax rbranch;

    public OperatorSyntax(String symbol, Syntax lbranch, Syntax rbranch, Mark mark) {
        super(name(symbol, lbranch, rbranch), arguments(lbranch, rbranch), mark);
        this.symbol = symbol;
        this.lbranch = lbranch;
        this.rbranch = rbranch;
    }

    private static String name(String symbol, Syntax lbranch, Syntax rbranch) {
        Objects.requireNonNull(symbol, "symbol must not be null");
        if (lbranch == null && rbranch == null) {
            throw new IllegalArgumentException("operator '" + symbol + "' must have at least one operand");
        }
        String name = symbol;
        if (lbranch == null) {
            name = name + "_";
        }
        if (rbranch == null) {
            name = "_" + name;
        }
        return name;
    }

    private static List<Syntax> arguments(Syntax lbranch, Syntax rbranch) {
        List<Syntax> arguments = new ArrayList<>();
        if (lbranch != null) {
            arguments.add(lbranch);
        }
        if (rbranch != null) {
            arguments.add(rbranch);
        }
        return arguments;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Returns the left operand, or null for a prefix operator.
     */
    public Syntax lbranch() {
        return lbranch;
    }

    /**
     * Returns the right operand, or null for a postfix operator.
     */
    public Syntax rbranch() {
        return rbranch;
    }

    @Override
    protected List<Object> basis() {
        return Arrays.asList(symbol, lbranch, rbranch);
    }

    @Override
    public String toString() {
        return (lbranch != null ? lbranch.toString() : "") + symbol + (rbranch != null ? rbranch.toString() : "");
    }
}
