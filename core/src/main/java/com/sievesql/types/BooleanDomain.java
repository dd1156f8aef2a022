package com.sievesql.types;

/**
 * The Boolean domain; literals are {@code true} and {@code false}.
 */
public record BooleanDomain() implements Domain {

    @Override
    public String family() {
        return "boolean";
    }

    @Override
    public Object parse(String data) {
        if (data == null) {
            return null;
        }
        if (data.equals("true")) {
            return Boolean.TRUE;
        }
        if (data.equals("false")) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException(
            "invalid Boolean literal: expected 'true' or 'false'; got '" + data + "'");
    }

    @Override
    public String dump(Object value) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Boolean bool)) {
            throw new IllegalArgumentException("not a Boolean value: " + value);
        }
        return bool ? "true" : "false";
    }

    @Override
    public String toString() {
        return family();
    }
}
