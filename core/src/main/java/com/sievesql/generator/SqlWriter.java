package com.sievesql.generator;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Accumulates SQL text and tracks the current column for indentation.
 *
 * <p>{@link #indent()} sets the indentation to the current column, so
 * nested clauses line up with the keyword that opened them.
 * {@link #newline()} starts a new line at the indentation, or pads the
 * current line if nothing has been written past the indentation yet.
 */
public final class SqlWriter {

    private final StringBuilder sql = new StringBuilder();
    private final Deque<Integer> indentationStack = new ArrayDeque<>();
    private int column;
    private int indentation;

    public SqlWriter write(String data) {
        sql.append(data);
        int newline = data.lastIndexOf('\n');
        if (newline >= 0) {
            column = data.length() - newline - 1;
        } else {
            column += data.length();
        }
        return this;
    }

    public void newline() {
        if (column <= indentation) {
            write(" ".repeat(indentation - column));
        } else {
            write("\n" + " ".repeat(indentation));
        }
    }

    public void indent() {
        indentationStack.push(indentation);
        indentation = column;
    }

    public void dedent() {
        indentation = indentationStack.pop();
    }

    public int column() {
        return column;
    }

    /**
     * Returns the accumulated text and resets the writer.
     *
     * @throws IllegalStateException if an indentation level is still open
     */
    public String flush() {
        if (indentation != 0 || !indentationStack.isEmpty()) {
            throw new IllegalStateException("unbalanced indentation");
        }
        String output = sql.toString();
        sql.setLength(0);
        column = 0;
        return output;
    }
}
