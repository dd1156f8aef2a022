package com.sievesql.frame;

import java.util.Objects;

/**
 * An item of the {@code FROM} clause: a frame with the way it is joined to
 * the items before it.
 */
public class Anchor {

    private final Frame frame;
    private final Phrase condition;
    private final boolean isLeft;
    private final boolean isRight;

    public Anchor(Frame frame, Phrase condition, boolean isLeft, boolean isRight) {
        this.frame = Objects.requireNonNull(frame, "frame must not be null");
        this.condition = condition;
        this.isLeft = isLeft;
        this.isRight = isRight;
    }

    public Frame frame() {
        return frame;
    }

    /**
     * Returns the join condition, or null for a cross join.
     */
    public Phrase condition() {
        return condition;
    }

    public boolean isLeft() {
        return isLeft;
    }

    public boolean isRight() {
        return isRight;
    }

    public boolean isCross() {
        return condition == null && !isLeft && !isRight;
    }

    public boolean isInner() {
        return condition != null && !isLeft && !isRight;
    }

    public boolean isLeading() {
        return false;
    }

    public Anchor with(Frame frame, Phrase condition) {
        return new Anchor(frame, condition, isLeft, isRight);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        Anchor other = (Anchor) obj;
        return isLeft == other.isLeft && isRight == other.isRight
                && frame.equals(other.frame) && Objects.equals(condition, other.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), frame, condition, isLeft, isRight);
    }

    @Override
    public String toString() {
        String kind = isLeading() ? "FROM" : isCross() ? "CROSS" : isInner() ? "INNER" : "LEFT";
        return kind + " " + frame + (condition != null ? " ON " + condition : "");
    }
}
