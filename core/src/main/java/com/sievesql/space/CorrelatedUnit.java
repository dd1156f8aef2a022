package com.sievesql.space;

import com.sievesql.binding.Binding;

/**
 * A value of a correlated subquery over the plural space, used for
 * {@code exists} and {@code every}.
 */
public final class CorrelatedUnit extends PluralUnit {

    public CorrelatedUnit(Code code, Space pluralSpace, Space space, Binding binding) {
        super(code, pluralSpace, space, binding);
    }

    @Override
    public CorrelatedUnit withSpace(Space space) {
        return new CorrelatedUnit(code(), pluralSpace(), space, binding());
    }

    @Override
    public CorrelatedUnit withCode(Code code) {
        return new CorrelatedUnit(code, pluralSpace(), space(), binding());
    }

    @Override
    public CorrelatedUnit withPluralSpace(Space pluralSpace) {
        return new CorrelatedUnit(code(), pluralSpace, space(), binding());
    }

    @Override
    public String toString() {
        return "(" + code() + " @@ " + pluralSpace() + " / " + space() + ")";
    }
}
