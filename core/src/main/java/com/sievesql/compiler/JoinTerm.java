package com.sievesql.compiler;

import com.sievesql.space.Space;
import com.sievesql.space.Unit;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Two terms joined on a list of joints. An empty joint list is a cross
 * join.
 */
public final class JoinTerm extends BinaryTerm {

    private final List<Joint> joints;
    private final boolean isLeft;
    private final boolean isRight;

    public JoinTerm(int tag, Term lkid, Term rkid, List<Joint> joints, boolean isLeft, boolean isRight,
                    Space space, Space baseline, Map<Unit, Integer> routes) {
        super(tag, lkid, rkid, space, baseline, routes);
        if (isRight) {
            throw new IllegalArgumentException("right outer joins are not produced");
        }
        this.joints = List.copyOf(joints);
        this.isLeft = isLeft;
        this.isRight = isRight;
    }

    public List<Joint> joints() {
        return joints;
    }

    /**
     * Returns true if rows of the left kid are kept when the right kid has
     * no match.
     */
    public boolean isLeft() {
        return isLeft;
    }

    public boolean isRight() {
        return isRight;
    }

    @Override
    public String toString() {
        String conditions = joints.stream().map(Joint::toString).collect(Collectors.joining(", "));
        return "(" + lkid() + (isLeft ? " +* " : " ++ ") + rkid()
                + (conditions.isEmpty() ? "" : " | " + conditions) + ")";
    }
}
