package com.sievesql.binding;

import com.sievesql.syntax.Syntax;
import com.sievesql.types.Profile;
import com.sievesql.types.VoidDomain;

/**
 * The bound query: the output segment, its profile and the requested
 * format.
 */
public final class QueryBinding extends Binding {

    private final SegmentBinding segment;
    private final Profile profile;
    private final String format;

    public QueryBinding(RootBinding base, SegmentBinding segment, Profile profile, String format, Syntax syntax) {
        super(base, new VoidDomain(), syntax);
        this.segment = segment;
        this.profile = profile;
        this.format = format;
    }

    public SegmentBinding segment() {
        return segment;
    }

    public Profile profile() {
        return profile;
    }

    public String format() {
        return format;
    }
}
