package com.sievesql.compiler;

import com.sievesql.space.Code;

import java.util.Objects;

/**
 * An equality condition connecting two terms: {@code lop} is evaluated on
 * the left term and {@code rop} on the right one.
 */
public record Joint(Code lop, Code rop) {

    public Joint {
        Objects.requireNonNull(lop, "lop must not be null");
        Objects.requireNonNull(rop, "rop must not be null");
    }

    public Joint withLop(Code lop) {
        return new Joint(lop, rop);
    }

    public Joint withRop(Code rop) {
        return new Joint(lop, rop);
    }

    @Override
    public String toString() {
        return lop + "=" + rop;
    }
}
