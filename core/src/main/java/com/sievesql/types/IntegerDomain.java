package com.sievesql.types;

import java.math.BigInteger;

/**
 * The domain of integer numbers.
 *
 * <p>Values are unbounded {@link BigInteger}s; range checks belong to
 * the dialect that renders them.
 *
 * @param size the size in bits, or null if unknown
 */
public record IntegerDomain(Integer size) implements Domain {

    public IntegerDomain() {
        this(null);
    }

    @Override
    public String family() {
        return "integer";
    }

    @Override
    public Object parse(String data) {
        if (data == null) {
            return null;
        }
        try {
            return new BigInteger(data.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "invalid integer literal: expected an integer in a decimal format; got '" + data + "'", e);
        }
    }

    @Override
    public String dump(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigInteger || value instanceof Long || value instanceof Integer) {
            return value.toString();
        }
        throw new IllegalArgumentException("not an integer value: " + value);
    }

    @Override
    public String toString() {
        return family();
    }
}
