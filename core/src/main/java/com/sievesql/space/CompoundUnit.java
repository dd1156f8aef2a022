package com.sievesql.space;

import com.sievesql.binding.Binding;

import java.util.Objects;

/**
 * A unit wrapping a code evaluated in some other space.
 */
public abstract class CompoundUnit extends Unit {

    private final Code code;

    protected CompoundUnit(Code code, Space space, Binding binding) {
        super(space, code.domain(), binding);
        this.code = Objects.requireNonNull(code, "code must not be null");
    }

    public Code code() {
        return code;
    }

    /**
     * Returns the same unit wrapping another code.
     */
    public abstract CompoundUnit withCode(Code code);
}
