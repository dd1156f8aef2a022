package com.sievesql.types;

/**
 * The domain of table records (rows of a class).
 */
public record EntityDomain() implements Domain {

    @Override
    public String family() {
        return "entity";
    }

    @Override
    public String toString() {
        return family();
    }
}
