package com.sievesql.mark;

/**
 * A node that remembers the fragment of the query it was produced from.
 */
public interface Marked {

    /**
     * Returns the source fragment of this node.
     *
     * @return the mark, never null ({@link Mark#EMPTY} for synthetic nodes)
     */
    Mark mark();
}
