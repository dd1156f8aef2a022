package com.sievesql.exception;

import com.sievesql.mark.Mark;

/**
 * Raised on malformed lexical input: an unterminated string, an unknown character, a bad percent-escape or an undecodable byte sequence.
 */
public class ScanError extends TranslateError {

    public ScanError(String detail, Mark mark) {
        super("scan", detail, mark, (String) null);
    }

    public ScanError(String detail, Mark mark, String hint) {
        super("scan", detail, mark, hint);
    }

    public ScanError(String detail, Mark mark, Throwable cause) {
        super("scan", detail, mark, cause);
    }
}
