package com.sievesql.catalog;

import java.util.List;

/**
 * A name shared by several arcs none of which wins.
 */
public record AmbiguousArc(List<Arc> alternatives) implements Arc {

    public AmbiguousArc {
        alternatives = List.copyOf(alternatives);
    }
}
