package com.sievesql.frame;

import com.sievesql.mark.Mark;
import com.sievesql.mark.Marked;
import com.sievesql.space.Expression;
import com.sievesql.types.Domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * A scalar SQL expression.
 *
 * <p>Phrases compare structurally by class, domain, nullability and
 * {@link #basis()}. The expression a phrase was assembled from is kept for
 * error reporting and alias naming only.
 */
public abstract class Phrase implements Marked {

    private final Domain domain;
    private final boolean isNullable;
    private final Expression expression;

    protected Phrase(Domain domain, boolean isNullable, Expression expression) {
        this.domain = Objects.requireNonNull(domain, "domain must not be null");
        this.isNullable = isNullable;
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
    }

    public Domain domain() {
        return domain;
    }

    /**
     * Returns true if the phrase may evaluate to {@code NULL}.
     */
    public boolean isNullable() {
        return isNullable;
    }

    public Expression expression() {
        return expression;
    }

    @Override
    public Mark mark() {
        return expression.mark();
    }

    /**
     * Returns the same phrase with another nullability; phrases with a
     * fixed nullability return themselves.
     */
    public abstract Phrase withNullable(boolean isNullable);

    protected abstract Object[] basis();

    @Override
    public final boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        Phrase other = (Phrase) obj;
        return isNullable == other.isNullable
                && domain.equals(other.domain)
                && Arrays.equals(basis(), other.basis());
    }

    @Override
    public final int hashCode() {
        return 31 * Objects.hash(getClass(), domain, isNullable) + Arrays.hashCode(basis());
    }
}
