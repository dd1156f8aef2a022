package com.sievesql.frame;

import com.sievesql.space.Expression;
import com.sievesql.types.Domain;

/**
 * An item of the {@code SELECT} list of a nested frame, addressed by the
 * frame tag and the item position.
 *
 * <p>The frame itself is not referenced: it is looked up by tag when the
 * tree is serialized.
 */
public final class ReferencePhrase extends Phrase {

    private final int tag;
    private final int index;

    public ReferencePhrase(int tag, int index, Domain domain, boolean isNullable, Expression expression) {
        super(domain, isNullable, expression);
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative");
        }
        this.tag = tag;
        this.index = index;
    }

    public int tag() {
        return tag;
    }

    public int index() {
        return index;
    }

    @Override
    public Phrase withNullable(boolean isNullable) {
        return new ReferencePhrase(tag, index, domain(), isNullable, expression());
    }

    @Override
    protected Object[] basis() {
        return new Object[] {tag, index};
    }

    @Override
    public String toString() {
        return "(" + tag + ")[" + index + "]";
    }
}
