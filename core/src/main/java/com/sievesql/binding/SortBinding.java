package com.sievesql.binding;

import com.sievesql.syntax.Syntax;

import java.util.List;

/**
 * Rows of the base ordered and sliced.
 */
public final class SortBinding extends ChainingBinding {

    private final List<Binding> order;
    private final Integer limit;
    private final Integer offset;

    public SortBinding(Binding base, List<Binding> order, Integer limit, Integer offset, Syntax syntax) {
        super(base, base.domain(), syntax);
        this.order = List.copyOf(order);
        this.limit = limit;
        this.offset = offset;
    }

    public List<Binding> order() {
        return order;
    }

    /**
     * Returns the maximum number of rows, or null.
     */
    public Integer limit() {
        return limit;
    }

    /**
     * Returns the number of rows to skip, or null.
     */
    public Integer offset() {
        return offset;
    }
}
