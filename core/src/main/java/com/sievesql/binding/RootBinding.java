package com.sievesql.binding;

import com.sievesql.syntax.Syntax;

/**
 * The home scope the whole query is bound in.
 */
public final class RootBinding extends HomeBinding {

    public RootBinding(Syntax syntax) {
        super(null, syntax);
    }
}
