package com.sievesql.exception;

import com.sievesql.mark.Mark;

/**
 * Raised on a failure to lower a binding to a space or a code.
 */
public class EncodeError extends TranslateError {

    public EncodeError(String detail, Mark mark) {
        super("encode", detail, mark, (String) null);
    }

    public EncodeError(String detail, Mark mark, String hint) {
        super("encode", detail, mark, hint);
    }

    public EncodeError(String detail, Mark mark, Throwable cause) {
        super("encode", detail, mark, cause);
    }
}
