package com.sievesql.functions;

import java.util.Objects;

/**
 * A named argument position of a {@link SignatureKind}.
 *
 * <p>A singular slot holds one node (or null when optional); a plural slot
 * holds a list of nodes (possibly empty when optional).
 *
 * @param name the slot name
 * @param isMandatory whether the slot must be filled
 * @param isSingular whether the slot holds one node rather than a list
 */
public record Slot(String name, boolean isMandatory, boolean isSingular) {

    public Slot {
        Objects.requireNonNull(name, "name must not be null");
    }

    public static Slot of(String name) {
        return new Slot(name, true, true);
    }

    public static Slot optional(String name) {
        return new Slot(name, false, true);
    }

    public static Slot plural(String name) {
        return new Slot(name, true, false);
    }

    public static Slot optionalPlural(String name) {
        return new Slot(name, false, false);
    }
}
