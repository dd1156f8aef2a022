package com.sievesql.frame;

import com.sievesql.compiler.Term;

/**
 * The source of exactly one row with no columns.
 */
public final class ScalarFrame extends Frame {

    public ScalarFrame(int tag, Term term) {
        super(tag, term);
    }

    @Override
    protected Object[] basis() {
        return new Object[0];
    }

    @Override
    public String toString() {
        return "(" + tag() + ") SCALAR";
    }
}
