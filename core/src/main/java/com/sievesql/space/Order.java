package com.sievesql.space;

import java.util.Objects;

/**
 * A sort key: a code and a direction, {@code +1} for ascending and
 * {@code -1} for descending.
 */
public record Order(Code code, int direction) {

    public Order {
        Objects.requireNonNull(code, "code must not be null");
        if (direction != 1 && direction != -1) {
            throw new IllegalArgumentException("direction must be +1 or -1; got " + direction);
        }
    }
}
