package com.sievesql.types;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The domain of calendar dates; literals have the form {@code YYYY-MM-DD}.
 */
public record DateDomain() implements Domain {

    private static final Pattern LITERAL = Pattern.compile("\\s*(\\d{4})-(\\d{2})-(\\d{2})\\s*");

    @Override
    public String family() {
        return "date";
    }

    @Override
    public Object parse(String data) {
        if (data == null) {
            return null;
        }
        Matcher matcher = LITERAL.matcher(data);
        if (!matcher.matches()) {
            throw new IllegalArgumentException(
                "invalid date literal: expected a valid date in a 'YYYY-MM-DD' format; got '" + data + "'");
        }
        try {
            return LocalDate.of(Integer.parseInt(matcher.group(1)),
                                Integer.parseInt(matcher.group(2)),
                                Integer.parseInt(matcher.group(3)));
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("invalid date literal: " + e.getMessage(), e);
        }
    }

    @Override
    public String dump(Object value) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof LocalDate date)) {
            throw new IllegalArgumentException("not a date value: " + value);
        }
        return date.toString();
    }

    @Override
    public String toString() {
        return family();
    }
}
