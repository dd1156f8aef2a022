package com.sievesql.binding;

import com.sievesql.syntax.Syntax;
import com.sievesql.types.Domain;
import com.sievesql.types.IdentityDomain;

import java.util.ArrayList;
import java.util.List;

/**
 * A tuple of values identifying a row: either the identity columns of a
 * table or the labels of a locator.
 */
public final class IdentityBinding extends Binding {

    private final List<Binding> elements;

    public IdentityBinding(Binding base, List<Binding> elements, Syntax syntax) {
        super(base, domainOf(elements), syntax);
        this.elements = List.copyOf(elements);
    }

    private static IdentityDomain domainOf(List<Binding> elements) {
        List<Domain> labels = new ArrayList<>();
        for (Binding element : elements) {
            labels.add(element.domain());
        }
        return new IdentityDomain(labels);
    }

    public List<Binding> elements() {
        return elements;
    }

    /**
     * Returns the number of scalar leaves.
     */
    public int width() {
        int width = 0;
        for (Binding element : elements) {
            width += element instanceof IdentityBinding identity ? identity.width() : 1;
        }
        return width;
    }

    @Override
    public IdentityDomain domain() {
        return (IdentityDomain) super.domain();
    }
}
