package com.sievesql.compiler;

import com.sievesql.space.OrderedSpace;

/**
 * Compiles a sorted space carrying a limit or an offset.
 *
 * <p>Backends with {@code LIMIT}/{@code OFFSET} keep the slice on an
 * {@link OrderTerm}; backends without it filter on a row counter instead.
 */
public interface PaginationStrategy {

    /**
     * Compiles the sliced space.
     *
     * @param space a space whose limit or offset is set
     * @param compiler the compiler to use for the base of the space
     * @return the compiled term
     */
    Term compile(OrderedSpace space, Compiler compiler);
}
