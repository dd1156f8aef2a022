package com.sievesql.binding;

import com.sievesql.syntax.Syntax;
import com.sievesql.types.EntityDomain;

/**
 * The scope of all tables: a scalar space with the tables as attributes.
 */
public class HomeBinding extends ScopingBinding {

    public HomeBinding(Binding base, Syntax syntax) {
        super(base, new EntityDomain(), syntax);
    }
}
