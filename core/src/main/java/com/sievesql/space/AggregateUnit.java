package com.sievesql.space;

import com.sievesql.binding.Binding;

/**
 * An aggregate function computed by grouping the plural space.
 */
public final class AggregateUnit extends PluralUnit {

    public AggregateUnit(Code code, Space pluralSpace, Space space, Binding binding) {
        super(code, pluralSpace, space, binding);
    }

    @Override
    public AggregateUnit withSpace(Space space) {
        return new AggregateUnit(code(), pluralSpace(), space, binding());
    }

    @Override
    public AggregateUnit withCode(Code code) {
        return new AggregateUnit(code, pluralSpace(), space(), binding());
    }

    @Override
    public AggregateUnit withPluralSpace(Space pluralSpace) {
        return new AggregateUnit(code(), pluralSpace, space(), binding());
    }

    @Override
    public String toString() {
        return "(" + code() + " @ " + pluralSpace() + " / " + space() + ")";
    }
}
