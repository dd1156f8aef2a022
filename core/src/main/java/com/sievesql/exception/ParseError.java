package com.sievesql.exception;

import com.sievesql.mark.Mark;

/**
 * Raised on a grammar violation.
 */
public class ParseError extends TranslateError {

    public ParseError(String detail, Mark mark) {
        super("parse", detail, mark, (String) null);
    }

    public ParseError(String detail, Mark mark, String hint) {
        super("parse", detail, mark, hint);
    }

    public ParseError(String detail, Mark mark, Throwable cause) {
        super("parse", detail, mark, cause);
    }
}
