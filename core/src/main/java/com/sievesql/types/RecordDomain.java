package com.sievesql.types;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The domain of selector output: a record with one field per selected column.
 *
 * @param fields the field profiles
 */
public record RecordDomain(List<Profile> fields) implements Domain {

    public RecordDomain {
        Objects.requireNonNull(fields, "fields must not be null");
        fields = List.copyOf(fields);
    }

    @Override
    public String family() {
        return "record";
    }

    @Override
    public String toString() {
        return fields.stream().map(Profile::toString).collect(Collectors.joining(", ", "{", "}"));
    }
}
