package com.sievesql.types;

import java.util.Objects;

/**
 * The domain of backend-specific values the translator does not understand.
 *
 * <p>Unlike other domains, opaque domains are compared by identity: two
 * opaque domains are never equal, even if they share a name.
 */
public final class OpaqueDomain implements Domain {

    private final String name;

    public OpaqueDomain(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Returns the backend name of the type.
     */
    public String name() {
        return name;
    }

    @Override
    public String family() {
        return "opaque";
    }

    @Override
    public Object parse(String data) {
        return data;
    }

    @Override
    public String dump(Object value) {
        return value == null ? null : value.toString();
    }

    @Override
    public String toString() {
        return family();
    }
}
