package com.sievesql.runtime;

import com.sievesql.types.Domain;

import java.util.Objects;

/**
 * A column of the query output.
 *
 * @param title the column header shown to the user
 * @param domain the type of the column values
 */
public record OutputColumn(String title, Domain domain) {

    public OutputColumn {
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(domain, "domain must not be null");
    }
}
