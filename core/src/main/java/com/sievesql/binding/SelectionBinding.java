package com.sievesql.binding;

import com.sievesql.syntax.Syntax;
import com.sievesql.types.RecordDomain;

import java.util.List;

/**
 * Rows of the base with the output columns given by a selector.
 */
public class SelectionBinding extends ChainingBinding {

    private final List<Binding> elements;

    public SelectionBinding(Binding base, List<Binding> elements, RecordDomain domain, Syntax syntax) {
        super(base, domain, syntax);
        this.elements = List.copyOf(elements);
    }

    public List<Binding> elements() {
        return elements;
    }

    @Override
    public RecordDomain domain() {
        return (RecordDomain) super.domain();
    }
}
