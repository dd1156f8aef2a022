package com.sievesql.space;

import com.sievesql.binding.Binding;

import java.util.List;
import java.util.Objects;

/**
 * The output rows of a query: the codes to produce for every row of the
 * space, relative to the root it is evaluated against.
 */
public final class SegmentExpr extends Expression {

    private final Space root;
    private final Space space;
    private final List<Code> codes;

    public SegmentExpr(Space root, Space space, List<Code> codes, Binding binding) {
        super(binding);
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.space = Objects.requireNonNull(space, "space must not be null");
        this.codes = List.copyOf(codes);
    }

    public Space root() {
        return root;
    }

    public Space space() {
        return space;
    }

    public List<Code> codes() {
        return codes;
    }

    public SegmentExpr with(Space root, Space space, List<Code> codes) {
        return new SegmentExpr(root, space, codes, binding());
    }

    @Override
    protected Object[] basis() {
        return new Object[] {root, space, codes};
    }
}
