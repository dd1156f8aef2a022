package com.sievesql.types;

/**
 * The domain of character strings.
 *
 * @param length the maximum length, or null if unbounded
 * @param isVarying whether the length is variable
 */
public record TextDomain(Integer length, boolean isVarying) implements Domain {

    public TextDomain() {
        this(null, true);
    }

    @Override
    public String family() {
        return "text";
    }

    @Override
    public Object parse(String data) {
        return data;
    }

    @Override
    public String dump(Object value) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new IllegalArgumentException("not a text value: " + value);
        }
        if (text.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("text value contains a NUL character");
        }
        return text;
    }

    @Override
    public String toString() {
        return family();
    }
}
