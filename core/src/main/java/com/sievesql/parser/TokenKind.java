package com.sievesql.parser;

/**
 * Kinds of lexical tokens.
 */
public enum TokenKind {
    /** An identifier. */
    NAME,
    /** A quoted string literal, stored unquoted. */
    STRING,
    /** An unquoted label inside a locator. */
    LABEL,
    /** A numeric literal. */
    NUMBER,
    /** An operator or punctuation symbol. */
    SYMBOL,
    /** The end of the query. */
    END
}
