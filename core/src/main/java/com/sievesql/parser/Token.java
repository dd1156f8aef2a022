package com.sievesql.parser;

import com.sievesql.mark.Mark;
import com.sievesql.mark.Marked;

import java.util.Objects;

/**
 * A lexical token.
 *
 * @param kind the token kind
 * @param value the token text; unquoted for strings, empty for the end token
 * @param mark the location of the token in the query
 */
public record Token(TokenKind kind, String value, Mark mark) implements Marked {

    public Token {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(mark, "mark must not be null");
    }

    /**
     * Returns true if this is a symbol token with the given value.
     */
    public boolean isSymbol(String symbol) {
        return kind == TokenKind.SYMBOL && value.equals(symbol);
    }

    @Override
    public String toString() {
        return kind + " '" + value + "'";
    }
}
