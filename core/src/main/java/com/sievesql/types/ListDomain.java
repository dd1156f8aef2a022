package com.sievesql.types;

import java.util.Objects;

/**
 * The domain of a segment: a list of items.
 *
 * @param item the domain of the list items
 */
public record ListDomain(Domain item) implements Domain {

    public ListDomain {
        Objects.requireNonNull(item, "item must not be null");
    }

    @Override
    public String family() {
        return "list";
    }

    @Override
    public String toString() {
        return "/" + item;
    }
}
