package com.sievesql.frame;

/**
 * The first item of the {@code FROM} clause.
 */
public final class LeadingAnchor extends Anchor {

    public LeadingAnchor(Frame frame) {
        super(frame, null, false, false);
    }

    @Override
    public boolean isCross() {
        return false;
    }

    @Override
    public boolean isLeading() {
        return true;
    }

    @Override
    public Anchor with(Frame frame, Phrase condition) {
        if (condition != null) {
            throw new IllegalArgumentException("a leading anchor has no condition");
        }
        return new LeadingAnchor(frame);
    }
}
