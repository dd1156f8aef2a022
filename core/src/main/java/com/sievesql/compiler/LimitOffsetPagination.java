package com.sievesql.compiler;

import com.sievesql.space.Order;
import com.sievesql.space.OrderedSpace;

import java.util.List;

/**
 * Keeps the slice on the sort term, rendered as {@code LIMIT} and
 * {@code OFFSET}.
 */
public final class LimitOffsetPagination implements PaginationStrategy {

    @Override
    public Term compile(OrderedSpace space, Compiler compiler) {
        List<Order> order = Stitcher.arrange(space);
        Term kid = compiler.compileSlicedBase(space, order);
        return new OrderTerm(compiler.tag(), kid, order, space.limit(), space.offset(),
                space, kid.baseline(), compiler.routesOf(kid, space));
    }
}
