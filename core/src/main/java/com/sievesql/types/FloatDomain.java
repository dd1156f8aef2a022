package com.sievesql.types;

import java.util.regex.Pattern;

/**
 * The domain of IEEE 754 floating-point numbers.
 *
 * <p>Infinities and NaN have no literal form.
 *
 * @param size the size in bits, or null if unknown
 */
public record FloatDomain(Integer size) implements Domain {

    private static final Pattern LITERAL =
        Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

    public FloatDomain() {
        this(null);
    }

    @Override
    public String family() {
        return "float";
    }

    @Override
    public Object parse(String data) {
        if (data == null) {
            return null;
        }
        String text = data.strip();
        if (!LITERAL.matcher(text).matches()) {
            throw new IllegalArgumentException("invalid float literal: " + data);
        }
        double value = Double.parseDouble(text);
        if (Double.isInfinite(value) || Double.isNaN(value)) {
            throw new IllegalArgumentException("invalid float literal: " + value);
        }
        return value;
    }

    @Override
    public String dump(Object value) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Double number)) {
            throw new IllegalArgumentException("not a float value: " + value);
        }
        return Double.toString(number);
    }

    @Override
    public String toString() {
        return family();
    }
}
