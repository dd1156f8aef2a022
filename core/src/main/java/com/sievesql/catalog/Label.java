package com.sievesql.catalog;

import java.util.Objects;

/**
 * An attribute name assigned to an arc.
 *
 * @param name the normalized attribute name
 * @param arc the named arc
 * @param isPublic whether the attribute appears in wildcard and default expansions
 */
public record Label(String name, Arc arc, boolean isPublic) {

    public Label {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(arc, "arc must not be null");
    }
}
