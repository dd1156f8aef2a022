package com.sievesql.binding;

import com.sievesql.mark.Mark;
import com.sievesql.mark.Marked;
import com.sievesql.syntax.Syntax;
import com.sievesql.types.Domain;

import java.util.Objects;

/**
 * A node of the binding graph: a syntax node with its names resolved and
 * its domain known.
 *
 * <p>Bindings fall into three groups:
 * <ul>
 *   <li>{@link ScopingBinding}: introduces a new naming scope
 *       (home, a table, a quotient);</li>
 *   <li>{@link ChainingBinding}: decorates its base and otherwise
 *       behaves like it (sieves, sorts, definitions, titles);</li>
 *   <li>everything else: expressions and the query/segment shell.</li>
 * </ul>
 *
 * <p>Bindings compare by identity.
 */
public abstract class Binding implements Marked {

    private final Binding base;
    private final Domain domain;
    private final Syntax syntax;

    protected Binding(Binding base, Domain domain, Syntax syntax) {
        this.base = base;
        this.domain = Objects.requireNonNull(domain, "domain must not be null");
        this.syntax = Objects.requireNonNull(syntax, "syntax must not be null");
    }

    /**
     * Returns the scope this binding was created in, or null for the root.
     */
    public Binding base() {
        return base;
    }

    public Domain domain() {
        return domain;
    }

    public Syntax syntax() {
        return syntax;
    }

    @Override
    public Mark mark() {
        return syntax.mark();
    }

    @Override
    public String toString() {
        return syntax.toString();
    }
}
