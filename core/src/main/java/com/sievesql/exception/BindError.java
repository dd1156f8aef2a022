package com.sievesql.exception;

import com.sievesql.mark.Mark;

/**
 * Raised on an unresolvable name, an arity mismatch, a failed coercion or a failed function dispatch.
 */
public class BindError extends TranslateError {

    public BindError(String detail, Mark mark) {
        super("bind", detail, mark, (String) null);
    }

    public BindError(String detail, Mark mark, String hint) {
        super("bind", detail, mark, hint);
    }

    public BindError(String detail, Mark mark, Throwable cause) {
        super("bind", detail, mark, cause);
    }
}
