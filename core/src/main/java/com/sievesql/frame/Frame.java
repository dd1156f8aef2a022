package com.sievesql.frame;

import com.sievesql.compiler.Term;
import com.sievesql.mark.Mark;
import com.sievesql.mark.Marked;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A SQL row source: a table, the one-row scalar source or a
 * {@code SELECT} statement.
 *
 * <p>The tag is copied from the term the frame was assembled from and is
 * unique within a query. Frames compare structurally by class, tag and
 * {@link #basis()}; the term is kept for error reporting and naming.
 */
public abstract class Frame implements Marked {

    private final int tag;
    private final Term term;

    protected Frame(int tag, Term term) {
        this.tag = tag;
        this.term = Objects.requireNonNull(term, "term must not be null");
    }

    public int tag() {
        return tag;
    }

    public Term term() {
        return term;
    }

    @Override
    public Mark mark() {
        return term.mark();
    }

    /**
     * Returns the frames nested in this one.
     */
    public List<Frame> kids() {
        return List.of();
    }

    protected abstract Object[] basis();

    @Override
    public final boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        Frame other = (Frame) obj;
        return tag == other.tag && Arrays.deepEquals(basis(), other.basis());
    }

    @Override
    public final int hashCode() {
        return 31 * Objects.hash(getClass(), tag) + Arrays.deepHashCode(basis());
    }
}
