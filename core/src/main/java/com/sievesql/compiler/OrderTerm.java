package com.sievesql.compiler;

import com.sievesql.space.Order;
import com.sievesql.space.Space;
import com.sievesql.space.Unit;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Rows of the kid sorted and sliced ({@code ORDER BY}, {@code LIMIT},
 * {@code OFFSET}).
 */
public final class OrderTerm extends UnaryTerm {

    private final List<Order> order;
    private final Integer limit;
    private final Integer offset;

    public OrderTerm(int tag, Term kid, List<Order> order, Integer limit, Integer offset,
                     Space space, Space baseline, Map<Unit, Integer> routes) {
        super(tag, kid, space, baseline, routes);
        if ((limit != null && limit < 0) || (offset != null && offset < 0)) {
            throw new IllegalArgumentException("limit and offset must not be negative");
        }
        this.order = List.copyOf(order);
        this.limit = limit;
        this.offset = offset;
    }

    public List<Order> order() {
        return order;
    }

    public Integer limit() {
        return limit;
    }

    public Integer offset() {
        return offset;
    }

    @Override
    public String toString() {
        String keys = order.stream().map(item -> item.code().toString()).collect(Collectors.joining(","));
        return kid() + " [" + keys + (limit != null ? ";:" + limit : "") + (offset != null ? ";" + offset + ":" : "")
                + "]";
    }
}
