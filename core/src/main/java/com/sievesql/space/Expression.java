package com.sievesql.space;

import com.sievesql.binding.Binding;
import com.sievesql.mark.Mark;
import com.sievesql.mark.Marked;

import java.util.Arrays;
import java.util.Objects;

/**
 * Base class for the nodes of the space/code graph.
 *
 * <p>Unlike bindings, expressions compare structurally: two nodes are equal
 * when they are of the same class and their {@link #basis()} elements are
 * equal. The originating binding is kept for error reporting only and does
 * not take part in equality.
 *
 * <p>Expressions are immutable, so the hash code is computed once.
 */
public abstract class Expression implements Marked {

    private final Binding binding;
    private int hash;
    private boolean isHashed;

    protected Expression(Binding binding) {
        this.binding = Objects.requireNonNull(binding, "binding must not be null");
    }

    /**
     * Returns the binding this node was encoded from.
     */
    public Binding binding() {
        return binding;
    }

    @Override
    public Mark mark() {
        return binding.mark();
    }

    /**
     * Returns the values that determine the identity of this node.
     *
     * <p>Elements may be null.
     */
    protected abstract Object[] basis();

    @Override
    public final boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        Expression other = (Expression) obj;
        if (hashCode() != other.hashCode()) {
            return false;
        }
        return Arrays.equals(basis(), other.basis());
    }

    @Override
    public final int hashCode() {
        if (!isHashed) {
            hash = 31 * getClass().hashCode() + Arrays.hashCode(basis());
            isHashed = true;
        }
        return hash;
    }

    @Override
    public String toString() {
        return binding.toString();
    }
}
