package com.sievesql.exception;

import com.sievesql.mark.Mark;

/**
 * Raised on a value that cannot be represented in the target dialect.
 */
public class SerializeError extends TranslateError {

    public SerializeError(String detail, Mark mark) {
        super("serialize", detail, mark, (String) null);
    }

    public SerializeError(String detail, Mark mark, String hint) {
        super("serialize", detail, mark, hint);
    }

    public SerializeError(String detail, Mark mark, Throwable cause) {
        super("serialize", detail, mark, cause);
    }
}
