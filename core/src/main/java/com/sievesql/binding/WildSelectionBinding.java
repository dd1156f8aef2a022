package com.sievesql.binding;

import com.sievesql.syntax.Syntax;
import com.sievesql.types.RecordDomain;

import java.util.List;

/**
 * A selection produced by the {@code *} wildcard.
 */
public final class WildSelectionBinding extends SelectionBinding {

    public WildSelectionBinding(Binding base, List<Binding> elements, RecordDomain domain, Syntax syntax) {
        super(base, elements, domain, syntax);
    }
}
