package com.sievesql.binding;

import com.sievesql.syntax.Syntax;

/**
 * Marks the base as a sort key, ascending ({@code +1}) or descending
 * ({@code -1}).
 */
public final class DirectionBinding extends WrappingBinding {

    private final int direction;

    public DirectionBinding(Binding base, int direction, Syntax syntax) {
        super(base, syntax);
        if (direction != 1 && direction != -1) {
            throw new IllegalArgumentException("direction must be +1 or -1");
        }
        this.direction = direction;
    }

    public int direction() {
        return direction;
    }
}
