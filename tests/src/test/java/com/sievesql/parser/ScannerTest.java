package com.sievesql.parser;

import com.sievesql.exception.ScanError;
import com.sievesql.test.TestBase;
import com.sievesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Scanner}: token kinds, percent-decoding, locator groups
 * and scan errors.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Scanner Tests")
public class ScannerTest extends TestBase {

    private static List<TokenKind> kinds(TokenStream stream) {
        return stream.tokens().stream().map(Token::kind).toList();
    }

    private static List<String> values(TokenStream stream) {
        return stream.tokens().stream().map(Token::value).toList();
    }

    @Nested
    @DisplayName("Tokens")
    class Tokens {

        @Test
        @DisplayName("TC-SCAN-001: selector splits into symbols and names")
        void testSelector() {
            logStep("Scan a table with a selector");
            TokenStream stream = Scanner.scan("/school{code, name}");

            assertThat(kinds(stream)).containsExactly(
                TokenKind.SYMBOL, TokenKind.NAME, TokenKind.SYMBOL, TokenKind.NAME,
                TokenKind.SYMBOL, TokenKind.NAME, TokenKind.SYMBOL, TokenKind.END);
            assertThat(values(stream)).containsExactly("/", "school", "{", "code", ",", "name", "}", "");
        }

        @Test
        @DisplayName("TC-SCAN-002: quoted strings are unquoted")
        void testString() {
            TokenStream stream = Scanner.scan("/'it''s'");

            Token token = stream.tokens().get(1);
            assertThat(token.kind()).isEqualTo(TokenKind.STRING);
            assertThat(token.value()).isEqualTo("it's");
            assertThat(token.mark().text()).isEqualTo("'it''s'");
        }

        @Test
        @DisplayName("TC-SCAN-003: numbers in integer, decimal and exponential notation")
        void testNumbers() {
            TokenStream stream = Scanner.scan("/{1, 2.5, 1e3, .5}");

            List<String> numbers = stream.tokens().stream()
                .filter(token -> token.kind() == TokenKind.NUMBER)
                .map(Token::value)
                .toList();
            assertThat(numbers).containsExactly("1", "2.5", "1e3", ".5");
        }

        @Test
        @DisplayName("TC-SCAN-004: longest operators win")
        void testOperators() {
            TokenStream stream = Scanner.scan("/{a!==b, c<=d, e:=f}");

            assertThat(values(stream)).contains("!==", "<=", ":=");
            assertThat(values(stream)).doesNotContain("!", "<", ":");
        }

        @Test
        @DisplayName("TC-SCAN-005: whitespace is discarded")
        void testWhitespace() {
            TokenStream stream = Scanner.scan("/ school \n ? code = 'a'");

            assertThat(values(stream)).containsExactly("/", "school", "?", "code", "=", "a", "");
        }

        @Test
        @DisplayName("TC-SCAN-006: locator labels use their own lexical group")
        void testLocator() {
            TokenStream stream = Scanner.scan("/course[astro.101]");

            assertThat(kinds(stream)).containsExactly(
                TokenKind.SYMBOL, TokenKind.NAME, TokenKind.SYMBOL, TokenKind.LABEL,
                TokenKind.SYMBOL, TokenKind.LABEL, TokenKind.SYMBOL, TokenKind.END);
            assertThat(values(stream)).containsExactly("/", "course", "[", "astro", ".", "101", "]", "");
        }

        @Test
        @DisplayName("TC-SCAN-007: non-ASCII identifiers")
        void testUnicodeName() {
            TokenStream stream = Scanner.scan("/école");

            assertThat(stream.tokens().get(1).kind()).isEqualTo(TokenKind.NAME);
            assertThat(stream.tokens().get(1).value()).isEqualTo("école");
        }
    }

    @Nested
    @DisplayName("Percent-decoding")
    class PercentDecoding {

        @Test
        @DisplayName("TC-SCAN-008: escapes are decoded before scanning")
        void testEscapes() {
            TokenStream stream = Scanner.scan("/school%7Bname%7D");

            assertThat(values(stream)).containsExactly("/", "school", "{", "name", "}", "");
        }

        @Test
        @DisplayName("TC-SCAN-009: multi-byte UTF-8 sequences")
        void testUtf8() {
            assertThat(Scanner.decode("/%C3%A9cole")).isEqualTo("/école");
        }

        @Test
        @DisplayName("TC-SCAN-010: a truncated escape is rejected")
        void testTruncatedEscape() {
            assertThatThrownBy(() -> Scanner.scan("/school%2"))
                .isInstanceOf(ScanError.class)
                .hasMessage("symbol '%' must be followed by two hexdecimal digits");
        }

        @Test
        @DisplayName("TC-SCAN-011: invalid UTF-8 is rejected")
        void testInvalidUtf8() {
            assertThatThrownBy(() -> Scanner.scan("/%FF"))
                .isInstanceOf(ScanError.class)
                .hasMessageStartingWith("cannot convert a byte sequence %FF to UTF-8");
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("TC-SCAN-012: unterminated string")
        void testUnterminatedString() {
            assertThatThrownBy(() -> Scanner.scan("/{'abc}"))
                .isInstanceOf(ScanError.class)
                .hasMessage("cannot find a matching quote mark");
        }

        @Test
        @DisplayName("TC-SCAN-013: unmatched closing bracket")
        void testUnmatchedBracket() {
            assertThatThrownBy(() -> Scanner.scan("/course]"))
                .isInstanceOf(ScanError.class)
                .hasMessage("cannot find a matching '['");
        }

        @Test
        @DisplayName("TC-SCAN-014: unterminated locator")
        void testUnterminatedLocator() {
            assertThatThrownBy(() -> Scanner.scan("/course[astro"))
                .isInstanceOf(ScanError.class)
                .hasMessage("cannot find a matching ']'");
        }

        @Test
        @DisplayName("TC-SCAN-015: unknown symbol is marked")
        void testUnknownSymbol() {
            ScanError error = catchThrowableOfType(() -> Scanner.scan("/school#"), ScanError.class);

            assertThat(error).isNotNull();
            assertThat(error.detail()).isEqualTo("unexpected symbol '#'");
            assertThat(error.mark().start()).isEqualTo(7);
            assertThat(error.mark().text()).isEqualTo("#");
            assertThat(error.getUserMessage()).contains("/school#").contains("       ^");
        }
    }
}
