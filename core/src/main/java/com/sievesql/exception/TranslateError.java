package com.sievesql.exception;

import com.sievesql.mark.Mark;

import java.util.List;
import java.util.Objects;

/**
 * Base class of all errors raised while translating a query.
 *
 * <p>Every error carries the kind of the failed stage, a detail message,
 * the mark of the offending fragment of the query and, optionally, a hint
 * suggesting how to fix the query.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       CompiledSql sql = new Translator().translate("/{1 + 'x'}", scope);
 *   } catch (TranslateError e) {
 *       System.err.println(e.getUserMessage());
 *   }
 * </pre>
 *
 * @see ScanError
 * @see ParseError
 * @see BindError
 */
public class TranslateError extends RuntimeException {

    private final String kind;
    private final String detail;
    private final Mark mark;
    private final String hint;

    /**
     * Creates a translation error.
     *
     * @param kind the name of the failed stage
     * @param detail the error message
     * @param mark the offending fragment of the query
     * @param hint an optional hint, may be null
     */
    public TranslateError(String kind, String detail, Mark mark, String hint) {
        super(detail);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.detail = Objects.requireNonNull(detail, "detail must not be null");
        this.mark = mark != null ? mark : Mark.EMPTY;
        this.hint = hint;
    }

    /**
     * Creates a translation error wrapping an unexpected failure.
     *
     * @param kind the name of the failed stage
     * @param detail the error message
     * @param mark the best known location of the failure
     * @param cause the underlying exception
     */
    public TranslateError(String kind, String detail, Mark mark, Throwable cause) {
        super(detail, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.detail = Objects.requireNonNull(detail, "detail must not be null");
        this.mark = mark != null ? mark : Mark.EMPTY;
        this.hint = null;
    }

    public String kind() {
        return kind;
    }

    public String detail() {
        return detail;
    }

    public Mark mark() {
        return mark;
    }

    /**
     * Returns the hint, or null if there is none.
     */
    public String hint() {
        return hint;
    }

    /**
     * Returns a multi-line message for the user: the detail, the hint and
     * the excerpt of the query with the offending fragment underlined.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind).append(": ").append(detail);
        if (hint != null) {
            sb.append(" (").append(hint).append(")");
        }
        List<String> excerpt = mark.excerpt();
        if (!excerpt.isEmpty()) {
            sb.append("\nWhile translating:");
            for (String line : excerpt) {
                sb.append("\n    ").append(line);
            }
        }
        return sb.toString();
    }
}
