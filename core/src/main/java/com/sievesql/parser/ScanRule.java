package com.sievesql.parser;

import java.util.regex.Pattern;

/**
 * A pattern of the scanner together with what to do on a match.
 *
 * @param pattern the pattern, matched at the current position
 * @param kind the kind of the produced token, or null if the match is discarded
 * @param unquote whether the match is a quoted string to unquote
 * @param push the name of the group to enter after the match, or null
 * @param pop whether to leave the current group after the match
 * @param error the error to raise on a match, or null
 */
record ScanRule(Pattern pattern, TokenKind kind, boolean unquote, String push, boolean pop, String error) {

    static ScanRule skip(String regex) {
        return new ScanRule(Pattern.compile(regex), null, false, null, false, null);
    }

    static ScanRule token(String regex, TokenKind kind) {
        return new ScanRule(Pattern.compile(regex), kind, false, null, false, null);
    }

    static ScanRule quoted(String regex) {
        return new ScanRule(Pattern.compile(regex), TokenKind.STRING, true, null, false, null);
    }

    static ScanRule error(String regex, String message) {
        return new ScanRule(Pattern.compile(regex), null, false, null, false, message);
    }

    ScanRule pushing(String group) {
        return new ScanRule(pattern, kind, unquote, group, pop, error);
    }

    ScanRule popping() {
        return new ScanRule(pattern, kind, unquote, push, true, error);
    }
}
