package com.sievesql.types;

import java.util.Objects;

/**
 * Describes a field of a record: its domain, the name it could be referred
 * to by, and the header to display.
 *
 * @param domain the field domain
 * @param tag the attribute name the field was derived from, or null
 * @param header the display title, or null
 */
public record Profile(Domain domain, String tag, String header) {

    public Profile {
        Objects.requireNonNull(domain, "domain must not be null");
    }

    @Override
    public String toString() {
        return domain.toString();
    }
}
