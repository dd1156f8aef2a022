package com.sievesql.space;

import com.sievesql.binding.Binding;

/**
 * A kernel code of a quotient, read from the row of the quotient.
 */
public final class KernelUnit extends CompoundUnit {

    public KernelUnit(Code code, Space space, Binding binding) {
        super(code, space, binding);
        if (!(space.family() instanceof QuotientFamily)) {
            throw new IllegalArgumentException("kernel unit requires a quotient space: " + space);
        }
    }

    @Override
    public KernelUnit withSpace(Space space) {
        return new KernelUnit(code(), space, binding());
    }

    @Override
    public KernelUnit withCode(Code code) {
        return new KernelUnit(code, space(), binding());
    }

    @Override
    protected Object[] basis() {
        return new Object[] {code(), space()};
    }

    @Override
    public String toString() {
        return "(" + code() + " # " + space() + ")";
    }
}
