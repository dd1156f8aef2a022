package com.sievesql.exception;

import com.sievesql.mark.Mark;

/**
 * Raised on a failure to build frames from terms.
 */
public class AssembleError extends TranslateError {

    public AssembleError(String detail, Mark mark) {
        super("assemble", detail, mark, (String) null);
    }

    public AssembleError(String detail, Mark mark, String hint) {
        super("assemble", detail, mark, hint);
    }

    public AssembleError(String detail, Mark mark, Throwable cause) {
        super("assemble", detail, mark, cause);
    }
}
