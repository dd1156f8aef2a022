package com.sievesql.syntax;

import com.sievesql.mark.Mark;
import com.sievesql.mark.Marked;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base class of the nodes of the syntax tree.
 *
 * <p>Syntax nodes are immutable. Two nodes are equal when they have the
 * same class and equal {@link #basis()}; marks do not take part in
 * equality. {@link #toString()} renders the node back to query text, with
 * control characters and {@code %} written as {@code %XX} escapes, so that
 * the result scans to an equal tree.
 */
public abstract class Syntax implements Marked {

    private static final Pattern UNSAFE = Pattern.compile("[\\x00-\\x1F%\\x7F]");

    private final Mark mark;
    private int hash;

    protected Syntax(Mark mark) {
        this.mark = Objects.requireNonNull(mark, "mark must not be null");
    }

    @Override
    public Mark mark() {
        return mark;
    }

    /**
     * Returns the values that determine the identity of the node.
     */
    protected abstract List<Object> basis();

    /**
     * Escapes characters that cannot appear in query text verbatim.
     */
    protected static String escape(String text) {
        Matcher matcher = UNSAFE.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, String.format("%%%02X", (int) matcher.group().charAt(0)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    @Override
    public final boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || obj.getClass() != getClass()) return false;
        return basis().equals(((Syntax) obj).basis());
    }

    @Override
    public final int hashCode() {
        if (hash == 0) {
            hash = Objects.hash(getClass(), basis());
        }
        return hash;
    }
}
