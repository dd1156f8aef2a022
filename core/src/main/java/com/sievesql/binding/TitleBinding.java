package com.sievesql.binding;

import com.sievesql.syntax.Syntax;

/**
 * Overrides the display title of the base ({@code :as(title)}).
 */
public final class TitleBinding extends WrappingBinding {

    private final String title;

    public TitleBinding(Binding base, String title, Syntax syntax) {
        super(base, syntax);
        this.title = title;
    }

    public String title() {
        return title;
    }
}
