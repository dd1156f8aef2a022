package com.sievesql.types;

import java.math.BigDecimal;

/**
 * The domain of exact decimal numbers.
 *
 * @param precision the number of significant digits, or null if unknown
 * @param scale the number of digits after the decimal point, or null if unknown
 */
public record DecimalDomain(Integer precision, Integer scale) implements Domain {

    public DecimalDomain() {
        this(null, null);
    }

    @Override
    public String family() {
        return "decimal";
    }

    @Override
    public Object parse(String data) {
        if (data == null) {
            return null;
        }
        try {
            return new BigDecimal(data.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid decimal literal: " + data, e);
        }
    }

    @Override
    public String dump(Object value) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof BigDecimal decimal)) {
            throw new IllegalArgumentException("not a decimal value: " + value);
        }
        return decimal.toString();
    }

    @Override
    public String toString() {
        return family();
    }
}
