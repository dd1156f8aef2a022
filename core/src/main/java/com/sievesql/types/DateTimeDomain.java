package com.sievesql.types;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The domain of timestamps; literals have the form
 * {@code YYYY-MM-DD[ HH:MM[:SS[.ffffff]]]}, with {@code T} accepted as the
 * date/time separator.
 */
public record DateTimeDomain() implements Domain {

    private static final Pattern LITERAL = Pattern.compile(
        "\\s*(\\d{4})-(\\d{2})-(\\d{2})"
        + "(?:(?:\\s+|[tT])(\\d{1,2}):(\\d{2})(?::(\\d{2})(?:\\.(\\d+))?)?)?\\s*");

    @Override
    public String family() {
        return "datetime";
    }

    @Override
    public Object parse(String data) {
        if (data == null) {
            return null;
        }
        Matcher matcher = LITERAL.matcher(data);
        if (!matcher.matches()) {
            throw new IllegalArgumentException(
                "invalid datetime literal: expected a valid date/time in a"
                + " 'YYYY-MM-DD HH:SS:MM.SSSSSS' format; got '" + data + "'");
        }
        try {
            return LocalDateTime.of(Integer.parseInt(matcher.group(1)),
                                    Integer.parseInt(matcher.group(2)),
                                    Integer.parseInt(matcher.group(3)),
                                    matcher.group(4) != null ? Integer.parseInt(matcher.group(4)) : 0,
                                    matcher.group(5) != null ? Integer.parseInt(matcher.group(5)) : 0,
                                    TimeDomain.seconds(matcher.group(6)),
                                    TimeDomain.nanos(matcher.group(7)));
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("invalid datetime literal: " + e.getMessage(), e);
        }
    }

    @Override
    public String dump(Object value) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof LocalDateTime dateTime)) {
            throw new IllegalArgumentException("not a datetime value: " + value);
        }
        return dateTime.toLocalDate() + " " + TimeDomain.format(dateTime.toLocalTime());
    }

    @Override
    public String toString() {
        return family();
    }
}
