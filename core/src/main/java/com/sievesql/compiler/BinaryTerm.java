package com.sievesql.compiler;

import com.sievesql.space.Space;
import com.sievesql.space.Unit;

import java.util.List;
import java.util.Map;

/**
 * A term with two kids.
 */
public abstract class BinaryTerm extends Term {

    protected BinaryTerm(int tag, Term lkid, Term rkid, Space space, Space baseline, Map<Unit, Integer> routes) {
        super(tag, List.of(lkid, rkid), space, baseline, routes);
    }

    public Term lkid() {
        return kids().get(0);
    }

    public Term rkid() {
        return kids().get(1);
    }
}
