package com.sievesql.types;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The domain of enumerated values.
 *
 * @param labels the valid values
 */
public record EnumDomain(List<String> labels) implements Domain {

    public EnumDomain {
        Objects.requireNonNull(labels, "labels must not be null");
        labels = List.copyOf(labels);
    }

    @Override
    public String family() {
        return "enum";
    }

    @Override
    public Object parse(String data) {
        if (data == null) {
            return null;
        }
        if (!labels.contains(data)) {
            throw new IllegalArgumentException(String.format(
                "invalid enum literal: expected one of %s; got '%s'",
                labels.stream().map(label -> "'" + label + "'").collect(Collectors.joining(", ")),
                data));
        }
        return data;
    }

    @Override
    public String dump(Object value) {
        if (value == null) {
            return null;
        }
        if (!labels.contains(value)) {
            throw new IllegalArgumentException("not a valid enum value: " + value);
        }
        return (String) value;
    }

    @Override
    public String toString() {
        return family();
    }
}
