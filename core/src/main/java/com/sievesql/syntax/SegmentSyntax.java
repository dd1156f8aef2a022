package com.sievesql.syntax;

import com.sievesql.mark.Mark;

import java.util.Arrays;
import java.util.List;

/**
 * A segment {@code /branch}; the branch is absent in the query {@code /}.
 */
public final class SegmentSyntax extends Syntax {

    private final Syntax branch;

    public SegmentSyntax(Syntax branch, Mark mark) {
        super(mark);
        this.branch = branch;
    }

    /**
     * Returns the segment body, or null for an empty segment.
     */
    public Syntax branch() {
        return branch;
    }

    @Override
    protected List<Object> basis() {
        return Arrays.asList(branch);
    }

    @Override
    public String toString() {
        if (branch == null) {
            return "/";
        }
        if (branch instanceof CommandSyntax) {
            return branch.toString();
        }
        return "/" + branch;
    }
}
