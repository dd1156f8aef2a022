package com.sievesql.binding;

import com.sievesql.syntax.Syntax;
import com.sievesql.types.VoidDomain;

/**
 * A format command applied to a segment ({@code /segment/:json}).
 */
public final class CommandBinding extends Binding {

    private final String format;
    private final SegmentBinding segment;

    public CommandBinding(Binding base, String format, SegmentBinding segment, Syntax syntax) {
        super(base, new VoidDomain(), syntax);
        this.format = format;
        this.segment = segment;
    }

    public String format() {
        return format;
    }

    public SegmentBinding segment() {
        return segment;
    }
}
