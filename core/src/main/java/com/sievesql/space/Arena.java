package com.sievesql.space;

import java.util.HashMap;
import java.util.Map;

/**
 * Interns spaces and codes so that structurally equal nodes built
 * independently end up as one shared instance.
 *
 * <p>Term construction keys joins and routes by space, so two equal
 * filters over the same table must collapse before compiling.
 */
public final class Arena {

    private final Map<Expression, Expression> nodes = new HashMap<>();

    /**
     * Returns the canonical instance of the node.
     */
    @SuppressWarnings("unchecked")
    public <T extends Expression> T intern(T node) {
        Expression existing = nodes.putIfAbsent(node, node);
        return existing == null ? node : (T) existing;
    }

    public boolean contains(Expression node) {
        return nodes.containsKey(node);
    }

    public int size() {
        return nodes.size();
    }
}
