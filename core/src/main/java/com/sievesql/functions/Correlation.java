package com.sievesql.functions;

import com.sievesql.types.Domain;

import java.util.List;
import java.util.Objects;

/**
 * One overload of a polymorphic function.
 *
 * <p>The overload applies to a formula of kind {@code kind} (or a subkind)
 * whose leading argument domains match one of {@code vectors}; domains are
 * compared by class. When applied, the formula switches to {@code target}
 * (if not null), its first {@code domains.size()} arguments are cast to
 * {@code domains} and the result gets {@code codomain}.
 *
 * @param kind the kind the overload is registered for
 * @param vectors the accepted argument domain vectors, all of equal length
 * @param target the kind to switch to, or null to keep it
 * @param domains the domains to cast the leading arguments to
 * @param codomain the result domain
 */
public record Correlation(SignatureKind kind, List<List<Domain>> vectors, SignatureKind target,
                          List<Domain> domains, Domain codomain) {

    public Correlation {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(codomain, "codomain must not be null");
        if (vectors.isEmpty()) {
            throw new IllegalArgumentException("at least one domain vector is expected");
        }
        vectors = vectors.stream().map(List::copyOf).toList();
        domains = List.copyOf(domains);
        int arity = vectors.get(0).size();
        for (List<Domain> vector : vectors) {
            if (vector.size() != arity) {
                throw new IllegalArgumentException("domain vectors must have equal length");
            }
        }
    }

    public int arity() {
        return vectors.get(0).size();
    }

    /**
     * Tests whether the overload applies to a formula of the given kind with
     * the given leading argument domains.
     */
    public boolean matches(SignatureKind key, List<Domain> vector) {
        if (!key.isSubkindOf(kind) || vector.size() < arity()) {
            return false;
        }
        for (List<Domain> candidate : vectors) {
            boolean isMatch = true;
            for (int index = 0; index < candidate.size(); index++) {
                if (candidate.get(index).getClass() != vector.get(index).getClass()) {
                    isMatch = false;
                    break;
                }
            }
            if (isMatch) {
                return true;
            }
        }
        return false;
    }

    /**
     * Tests whether this overload is preferred to another applicable one.
     */
    public boolean dominates(Correlation other) {
        return kind != other.kind && kind.isSubkindOf(other.kind);
    }
}
