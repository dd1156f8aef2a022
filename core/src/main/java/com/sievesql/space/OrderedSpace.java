package com.sievesql.space;

import com.sievesql.binding.Binding;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Rows of the base sorted and optionally sliced.
 */
public final class OrderedSpace extends Space {

    private final List<Order> order;
    private final Integer limit;
    private final Integer offset;

    public OrderedSpace(Space base, List<Order> order, Integer limit, Integer offset, Binding binding) {
        super(base, base.family(), true, limit == null && offset == null, binding);
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        if (offset != null && offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
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
    public boolean isCommutative() {
        return limit == null && offset == null;
    }

    @Override
    public Space withBase(Space base) {
        return new OrderedSpace(base, order, limit, offset, binding());
    }

    @Override
    protected Object[] basis() {
        return new Object[] {base(), order, limit, offset};
    }

    @Override
    public String toString() {
        String keys = order.stream().map(item -> String.valueOf(item.code())).collect(Collectors.joining(","));
        return base() + " [" + keys + (limit != null ? ";" + (offset != null ? offset : 0) + "+" + limit : "") + "]";
    }
}
