package com.sievesql.types;

/**
 * The domain of expressions without a value, such as assignments.
 */
public record VoidDomain() implements Domain {

    @Override
    public String family() {
        return "void";
    }

    @Override
    public String toString() {
        return family();
    }
}
