package com.sievesql.exception;

import com.sievesql.mark.Mark;

/**
 * Raised on a failure to lower a space graph to a term tree.
 */
public class CompileError extends TranslateError {

    public CompileError(String detail, Mark mark) {
        super("compile", detail, mark, (String) null);
    }

    public CompileError(String detail, Mark mark, String hint) {
        super("compile", detail, mark, hint);
    }

    public CompileError(String detail, Mark mark, Throwable cause) {
        super("compile", detail, mark, cause);
    }
}
