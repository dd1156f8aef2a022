package com.sievesql.binding;

import com.sievesql.catalog.Table;
import com.sievesql.syntax.Syntax;

/**
 * All rows of a table, not correlated to the enclosing scope.
 */
public final class FreeTableBinding extends TableBinding {

    public FreeTableBinding(Binding base, Table table, Syntax syntax) {
        super(base, table, syntax);
    }
}
