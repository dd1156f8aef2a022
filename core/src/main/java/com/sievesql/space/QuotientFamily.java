package com.sievesql.space;

import java.util.List;
import java.util.Objects;

/**
 * Distinct values of the kernel codes over the seed rows.
 *
 * @param seed the space being grouped
 * @param ground the topmost axis of the seed not spanned by the quotient base
 * @param kernels the grouping codes
 */
public record QuotientFamily(Space seed, Space ground, List<Code> kernels) implements Family {

    public QuotientFamily {
        Objects.requireNonNull(seed, "seed must not be null");
        Objects.requireNonNull(ground, "ground must not be null");
        kernels = List.copyOf(kernels);
    }
}
