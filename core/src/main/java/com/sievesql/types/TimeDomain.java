package com.sievesql.types;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The domain of times of day; literals have the form {@code HH:MM[:SS[.ffffff]]}.
 */
public record TimeDomain() implements Domain {

    private static final Pattern LITERAL =
        Pattern.compile("\\s*(\\d{1,2}):(\\d{2})(?::(\\d{2})(?:\\.(\\d+))?)?\\s*");

    @Override
    public String family() {
        return "time";
    }

    @Override
    public Object parse(String data) {
        if (data == null) {
            return null;
        }
        Matcher matcher = LITERAL.matcher(data);
        if (!matcher.matches()) {
            throw new IllegalArgumentException(
                "invalid time literal: expected a valid time in a 'HH:SS:MM.SSSSSS' format; got '" + data + "'");
        }
        try {
            return LocalTime.of(Integer.parseInt(matcher.group(1)),
                                Integer.parseInt(matcher.group(2)),
                                seconds(matcher.group(3)),
                                nanos(matcher.group(4)));
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("invalid time literal: " + e.getMessage(), e);
        }
    }

    @Override
    public String dump(Object value) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof LocalTime time)) {
            throw new IllegalArgumentException("not a time value: " + value);
        }
        return format(time);
    }

    static int seconds(String group) {
        return group != null ? Integer.parseInt(group) : 0;
    }

    static int nanos(String group) {
        if (group == null) {
            return 0;
        }
        String micros = (group + "000000").substring(0, 6);
        return Integer.parseInt(micros) * 1000;
    }

    static String format(LocalTime time) {
        String text = String.format("%02d:%02d:%02d", time.getHour(), time.getMinute(), time.getSecond());
        int micros = time.getNano() / 1000;
        if (micros != 0) {
            text += String.format(".%06d", micros);
        }
        return text;
    }

    @Override
    public String toString() {
        return family();
    }
}
