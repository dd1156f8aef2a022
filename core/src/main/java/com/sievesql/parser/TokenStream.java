package com.sievesql.parser;

import com.sievesql.exception.ParseError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A cursor over the tokens produced by the {@link Scanner}.
 *
 * <p>The last token is always {@link TokenKind#END}; peeking past it is a
 * programming error. When matching by kind, {@link TokenKind#STRING}
 * also accepts {@link TokenKind#LABEL} tokens.
 */
public final class TokenStream {

    private final List<Token> tokens;
    private int index;

    TokenStream(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).kind() != TokenKind.END) {
            throw new IllegalArgumentException("token stream must end with an END token");
        }
        this.tokens = List.copyOf(tokens);
        this.index = 0;
    }

    /**
     * Returns all tokens, including the consumed ones.
     */
    public List<Token> tokens() {
        return tokens;
    }

    /**
     * Returns the current token without consuming it.
     */
    public Token peek() {
        return tokens.get(index);
    }

    /**
     * Checks whether the current token has the given kind.
     */
    public boolean peek(TokenKind kind) {
        return peek(kind, null, 0, false, false) != null;
    }

    /**
     * Checks whether the current token is one of the given symbols.
     */
    public boolean peek(TokenKind kind, List<String> values) {
        return peek(kind, values, 0, false, false) != null;
    }

    /**
     * Checks whether the token {@code ahead} positions after the current one
     * is one of the given values.
     */
    public boolean peek(TokenKind kind, List<String> values, int ahead) {
        return peek(kind, values, ahead, false, false) != null;
    }

    /**
     * Examines a token.
     *
     * @param kind the expected kind, or null to accept any token
     * @param values the expected values, or null to accept any value
     * @param ahead the offset from the current token
     * @param doPop whether to consume the token and the tokens before it
     * @param doForce whether to fail if the token is not the expected one
     * @return the token, or null if it is not the expected one and {@code doForce} is off
     * @throws ParseError if {@code doForce} is on and the token is not the expected one
     */
    public Token peek(TokenKind kind, List<String> values, int ahead, boolean doPop, boolean doForce) {
        if (ahead < 0 || index + ahead >= tokens.size()) {
            throw new IndexOutOfBoundsException("cannot look " + ahead + " tokens ahead");
        }
        Token token = tokens.get(index + ahead);
        boolean isExpected = true;
        if (kind != null) {
            if (!matches(kind, token.kind())) {
                isExpected = false;
            } else if (values != null && !values.contains(token.value())) {
                isExpected = false;
            }
        }
        if (!isExpected) {
            if (!doForce) {
                return null;
            }
            String expected = kind.name();
            if (values != null && !values.isEmpty()) {
                if (values.size() == 1) {
                    expected = expected + " '" + values.get(0) + "'";
                } else {
                    expected = expected + values.stream()
                        .map(value -> "'" + value + "'")
                        .collect(Collectors.joining(", ", " (", ")"));
                }
            }
            String got = token.kind().name() + " '" + token.value() + "'";
            throw new ParseError("expected " + expected + "; got " + got, token.mark());
        }
        if (doPop) {
            index += ahead + 1;
        }
        return token;
    }

    /**
     * Consumes the current token.
     */
    public Token pop() {
        return peek(null, null, 0, true, true);
    }

    /**
     * Consumes the current token, which must have the given kind.
     *
     * @throws ParseError if the token has a different kind
     */
    public Token pop(TokenKind kind) {
        return peek(kind, null, 0, true, true);
    }

    /**
     * Consumes the current token, which must be one of the given values.
     *
     * @throws ParseError if the token is not the expected one
     */
    public Token pop(TokenKind kind, List<String> values) {
        return peek(kind, values, 0, true, true);
    }

    private static boolean matches(TokenKind expected, TokenKind actual) {
        return expected == actual || (expected == TokenKind.STRING && actual == TokenKind.LABEL);
    }
}
