package com.sievesql.mark;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A slice {@code [start, end)} of the query text.
 *
 * <p>Marks are created by the scanner and travel with every node built from
 * the tokens: syntax nodes, bindings, spaces and codes. They are used to point
 * at the offending fragment of the query when a translation error is reported.
 *
 * <p>Synthetic nodes use {@link #EMPTY}, which has no input and covers nothing.
 */
public final class Mark {

    /** The mark of nodes that do not originate from the query text. */
    public static final Mark EMPTY = new Mark("", 0, 0);

    private final String input;
    private final int start;
    private final int end;

    /**
     * Creates a mark.
     *
     * @param input the query text
     * @param start the offset of the first character of the slice
     * @param end the offset after the last character of the slice
     * @throws IllegalArgumentException if the offsets are out of bounds
     */
    public Mark(String input, int start, int end) {
        this.input = Objects.requireNonNull(input, "input must not be null");
        if (start < 0 || start > end || end > input.length()) {
            throw new IllegalArgumentException(String.format(
                "Invalid mark bounds [%d, %d) for input of length %d", start, end, input.length()));
        }
        this.start = start;
        this.end = end;
    }

    public String input() {
        return input;
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    /**
     * Returns true if this mark does not point at any text.
     */
    public boolean isEmpty() {
        return input.isEmpty() && start == 0 && end == 0;
    }

    /**
     * Returns the marked fragment of the input.
     */
    public String text() {
        return input.substring(start, end);
    }

    /**
     * Builds the smallest mark covering all the given nodes.
     *
     * <p>Accepts marks, {@link Marked} nodes, collections and arrays of them,
     * and nulls (ignored). Empty marks are skipped. If the nodes come from
     * different inputs, only the marks of the first input are used.
     *
     * @param nodes the nodes to cover
     * @return the union mark, or {@link #EMPTY} if no node carries a mark
     */
    public static Mark union(Object... nodes) {
        List<Mark> marks = new ArrayList<>();
        for (Object node : nodes) {
            collect(node, marks);
        }
        if (marks.isEmpty()) {
            return EMPTY;
        }
        String input = marks.get(0).input;
        int start = Integer.MAX_VALUE;
        int end = Integer.MIN_VALUE;
        for (Mark mark : marks) {
            if (!mark.input.equals(input)) {
                continue;
            }
            start = Math.min(start, mark.start);
            end = Math.max(end, mark.end);
        }
        return new Mark(input, start, end);
    }

    private static void collect(Object node, List<Mark> marks) {
        if (node == null) {
            return;
        }
        if (node instanceof Mark mark) {
            if (!mark.isEmpty()) {
                marks.add(mark);
            }
        } else if (node instanceof Marked marked) {
            collect(marked.mark(), marks);
        } else if (node instanceof Collection<?> collection) {
            for (Object item : collection) {
                collect(item, marks);
            }
        } else if (node instanceof Object[] array) {
            for (Object item : array) {
                collect(item, marks);
            }
        } else {
            throw new IllegalArgumentException("Cannot take a mark of " + node.getClass().getName());
        }
    }

    /**
     * Produces a two-line excerpt: the input line containing the mark and
     * a line with {@code ^} under the marked characters.
     *
     * @return the excerpt lines; empty for {@link #EMPTY}
     */
    public List<String> excerpt() {
        if (isEmpty()) {
            return List.of();
        }
        int lineStart = input.lastIndexOf('\n', Math.max(start - 1, 0)) + 1;
        if (start == 0) {
            lineStart = 0;
        }
        int lineEnd = input.indexOf('\n', start);
        if (lineEnd < 0) {
            lineEnd = input.length();
        }
        String line = input.substring(lineStart, lineEnd);
        int width = Math.max(Math.min(end, lineEnd) - start, 1);
        String pointer = " ".repeat(start - lineStart) + "^".repeat(width);
        return List.of(line, pointer);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Mark)) return false;
        Mark that = (Mark) obj;
        return start == that.start && end == that.end && input.equals(that.input);
    }

    @Override
    public int hashCode() {
        return Objects.hash(input, start, end);
    }

    @Override
    public String toString() {
        return String.format("Mark[%d:%d]", start, end);
    }
}
