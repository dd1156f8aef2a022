package com.sievesql.parser;

import com.sievesql.exception.ScanError;
import com.sievesql.mark.Mark;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Splits a query into tokens.
 *
 * <p>The query is first percent-decoded: every {@code %XX} escape is
 * replaced with the byte it encodes and the result is decoded as UTF-8.
 * The decoded text is then matched against the rules of the current
 * lexical group; the first rule that matches at the current position wins.
 * Two groups are used:
 * <ul>
 *   <li>{@code top}: names, strings, numbers and symbols; {@code [} enters
 *       the {@code locator} group;</li>
 *   <li>{@code locator}: labels, strings, {@code .} and brackets;
 *       an opening bracket enters a nested {@code locator} group and a
 *       closing bracket leaves it.</li>
 * </ul>
 *
 * <p>Whitespace is recognized and discarded. Scanning ends when the
 * {@code top} group matches the end of input, which produces an
 * {@link TokenKind#END} token.
 */
public final class Scanner {

    private static final String STRING = "'(?:[^'\\x00]|'')*'";

    private static final ScanGroup TOP = new ScanGroup("top", List.of(
        ScanRule.skip("\\s+"),
        ScanRule.token("(?U)(?!\\d)\\w+", TokenKind.NAME),
        ScanRule.quoted(STRING),
        ScanRule.error("'", "cannot find a matching quote mark"),
        ScanRule.token("(?:\\d*\\.)?\\d+[eE][+-]?\\d+|\\d*\\.\\d+|\\d+\\.?", TokenKind.NUMBER),
        ScanRule.token("~|!~|<=|<|>=|>|==|=|!==|!=|!|&|\\||->|\\.|,|\\?|\\^|/|\\*|\\+|-"
                       + "|\\(|\\)|\\{|\\}|:=|:|\\$|@", TokenKind.SYMBOL),
        ScanRule.token("\\[", TokenKind.SYMBOL).pushing("locator"),
        ScanRule.error("\\]", "cannot find a matching '['"),
        ScanRule.token("\\z", TokenKind.END).popping()
    ));

    private static final ScanGroup LOCATOR = new ScanGroup("locator", List.of(
        ScanRule.skip("\\s+"),
        ScanRule.token("[\\[(]", TokenKind.SYMBOL).pushing("locator"),
        ScanRule.token("[\\])]", TokenKind.SYMBOL).popping(),
        ScanRule.token("\\.", TokenKind.SYMBOL),
        ScanRule.token("(?U)[\\w-]+", TokenKind.LABEL),
        ScanRule.quoted(STRING),
        ScanRule.error("'", "cannot find a matching quote mark"),
        ScanRule.error("\\z", "cannot find a matching ']'")
    ));

    private static final Map<String, ScanGroup> GROUPS = Map.of(TOP.name(), TOP, LOCATOR.name(), LOCATOR);

    private Scanner() {
    }

    /**
     * Scans a query.
     *
     * @param query the raw query text
     * @return the stream of tokens, ending with an {@link TokenKind#END} token
     * @throws ScanError if the query cannot be tokenized
     */
    public static TokenStream scan(String query) {
        String input = decode(query);
        List<Token> tokens = new ArrayList<>();
        Deque<ScanGroup> stack = new ArrayDeque<>();
        stack.push(TOP);
        int start = 0;
        while (!stack.isEmpty()) {
            ScanGroup group = stack.peek();
            ScanRule matched = null;
            int end = start;
            for (ScanRule rule : group.rules()) {
                Matcher matcher = rule.pattern().matcher(input);
                matcher.region(start, input.length());
                matcher.useTransparentBounds(true);
                matcher.useAnchoringBounds(false);
                if (matcher.lookingAt()) {
                    matched = rule;
                    end = matcher.end();
                    break;
                }
            }
            if (matched == null) {
                int next = input.offsetByCodePoints(start, 1);
                throw new ScanError("unexpected symbol '" + input.substring(start, next) + "'",
                                    new Mark(input, start, next));
            }
            Mark mark = new Mark(input, start, end);
            String value = input.substring(start, end);
            if (matched.unquote()) {
                value = value.substring(1, value.length() - 1).replace("''", "'");
            }
            if (matched.kind() != null) {
                tokens.add(new Token(matched.kind(), value, mark));
            }
            if (matched.pop()) {
                stack.pop();
            }
            if (matched.push() != null) {
                stack.push(GROUPS.get(matched.push()));
            }
            if (matched.error() != null) {
                throw new ScanError(matched.error(), mark);
            }
            start = end;
        }
        return new TokenStream(tokens);
    }

    /**
     * Replaces percent-encoded bytes and decodes the result as UTF-8.
     */
    static String decode(String query) {
        if (query.indexOf('%') < 0) {
            return query;
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        int index = 0;
        while (index < query.length()) {
            char ch = query.charAt(index);
            if (ch == '%') {
                if (!isHex(query, index + 1) || !isHex(query, index + 2)) {
                    throw new ScanError("symbol '%' must be followed by two hexdecimal digits",
                                        new Mark(query, index, index + 1));
                }
                bytes.write(Integer.parseInt(query.substring(index + 1, index + 3), 16));
                index += 3;
            } else {
                int next = query.offsetByCodePoints(index, 1);
                byte[] encoded = query.substring(index, next).getBytes(StandardCharsets.UTF_8);
                bytes.write(encoded, 0, encoded.length);
                index = next;
            }
        }
        byte[] data = bytes.toByteArray();
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(data);
        CharBuffer out = CharBuffer.allocate(data.length + 1);
        CoderResult result = decoder.decode(in, out, true);
        if (result.isError()) {
            int position = in.position();
            int length = result.length();
            String text = new String(data, StandardCharsets.UTF_8);
            int start = new String(data, 0, position, StandardCharsets.UTF_8).length();
            int end = Math.min(start + 1, text.length());
            StringBuilder sequence = new StringBuilder();
            for (int i = position; i < position + length; i++) {
                sequence.append(String.format("%%%02X", data[i] & 0xFF));
            }
            throw new ScanError("cannot convert a byte sequence " + sequence + " to UTF-8: "
                                + (result.isMalformed() ? "invalid continuation or start byte" : "unmappable character"),
                                new Mark(text, start, end));
        }
        decoder.flush(out);
        out.flip();
        return out.toString();
    }

    private static boolean isHex(String query, int index) {
        return index < query.length() && Character.digit(query.charAt(index), 16) >= 0
            && query.charAt(index) < 128;
    }
}
