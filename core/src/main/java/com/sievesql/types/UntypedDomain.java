package com.sievesql.types;

/**
 * The domain of a literal whose type is determined by its context.
 *
 * <p>Untyped values are represented by the literal string itself.
 */
public record UntypedDomain() implements Domain {

    @Override
    public String family() {
        return "untyped";
    }

    @Override
    public Object parse(String data) {
        return data;
    }

    @Override
    public String dump(Object value) {
        return value == null ? null : value.toString();
    }

    @Override
    public String toString() {
        return family();
    }
}
