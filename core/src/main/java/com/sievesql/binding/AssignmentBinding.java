package com.sievesql.binding;

import com.sievesql.syntax.Syntax;
import com.sievesql.types.VoidDomain;

import java.util.List;
import java.util.Objects;

/**
 * An unevaluated assignment {@code name := body}.
 *
 * <p>The left side is a chain of names ({@code a.b.c := ...}); only the
 * last one may be a reference. A parameterized definition
 * ({@code f(x, $y) := ...}) carries its parameter list.
 */
public final class AssignmentBinding extends Binding {

    /**
     * A name on either side of an assignment.
     *
     * @param name the name as written
     * @param isReference whether the name is a {@code $reference}
     */
    public record Term(String name, boolean isReference) {

        public Term {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    private final List<Term> terms;
    private final List<Term> parameters;
    private final Syntax body;

    public AssignmentBinding(Binding base, List<Term> terms, List<Term> parameters, Syntax body, Syntax syntax) {
        super(base, new VoidDomain(), syntax);
        this.terms = List.copyOf(terms);
        this.parameters = parameters != null ? List.copyOf(parameters) : null;
        this.body = body;
    }

    public List<Term> terms() {
        return terms;
    }

    /**
     * Returns the parameters, or null when the definition takes none.
     */
    public List<Term> parameters() {
        return parameters;
    }

    public Syntax body() {
        return body;
    }
}
