package com.sievesql.parser;

import com.sievesql.exception.ParseError;
import com.sievesql.syntax.CommandSyntax;
import com.sievesql.syntax.FunctionSyntax;
import com.sievesql.syntax.IdentifierSyntax;
import com.sievesql.syntax.LocatorSyntax;
import com.sievesql.syntax.NumberSyntax;
import com.sievesql.syntax.OperatorSyntax;
import com.sievesql.syntax.QuerySyntax;
import com.sievesql.syntax.SelectorSyntax;
import com.sievesql.syntax.SieveSyntax;
import com.sievesql.syntax.StringSyntax;
import com.sievesql.syntax.Syntax;
import com.sievesql.syntax.WildcardSyntax;
import com.sievesql.test.TestBase;
import com.sievesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link QueryParser}: operator precedence, the direction and
 * command ambiguities, marks and parse errors.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("QueryParser Tests")
public class QueryParserTest extends TestBase {

    private static Syntax branch(String query) {
        return QueryParser.parse(query).segment().branch();
    }

    @Nested
    @DisplayName("Structure")
    class Structure {

        @Test
        @DisplayName("TC-PARSE-001: selector with one addition")
        void testSelectorWithAddition() {
            logStep("Parse /{1+1}");
            Syntax root = branch("/{1+1}");

            assertThat(root).isInstanceOf(SelectorSyntax.class);
            SelectorSyntax selector = (SelectorSyntax) root;
            assertThat(selector.lbranch()).isNull();
            assertThat(selector.rbranches()).hasSize(1);
            OperatorSyntax addition = (OperatorSyntax) selector.rbranches().get(0);
            assertThat(addition.symbol()).isEqualTo("+");
            assertThat(addition.lbranch()).isInstanceOf(NumberSyntax.class);
            assertThat(((NumberSyntax) addition.rbranch()).isInteger()).isTrue();
        }

        @Test
        @DisplayName("TC-PARSE-002: empty query has no branch")
        void testEmptyQuery() {
            QuerySyntax query = QueryParser.parse("/");

            assertThat(query.segment().branch()).isNull();
            assertThat(query.toString()).isEqualTo("/");
        }

        @Test
        @DisplayName("TC-PARSE-003: multiplication binds tighter than addition")
        void testPrecedence() {
            OperatorSyntax root = (OperatorSyntax) branch("/1+2*3");

            assertThat(root.symbol()).isEqualTo("+");
            assertThat(((OperatorSyntax) root.rbranch()).symbol()).isEqualTo("*");
        }

        @Test
        @DisplayName("TC-PARSE-004: conjunction binds tighter than disjunction")
        void testLogicalPrecedence() {
            SieveSyntax sieve = (SieveSyntax) branch("/school?a|b&c");

            OperatorSyntax filter = (OperatorSyntax) sieve.rbranch();
            assertThat(filter.symbol()).isEqualTo("|");
            assertThat(((OperatorSyntax) filter.rbranch()).symbol()).isEqualTo("&");
        }

        @Test
        @DisplayName("TC-PARSE-005: sieve over a comparison with a string")
        void testSieve() {
            SieveSyntax sieve = (SieveSyntax) branch("/school?code='art'");

            assertThat(sieve.lbranch()).isEqualTo(new IdentifierSyntax("school", sieve.lbranch().mark()));
            OperatorSyntax comparison = (OperatorSyntax) sieve.rbranch();
            assertThat(comparison.symbol()).isEqualTo("=");
            assertThat(comparison.rbranch()).isInstanceOf(StringSyntax.class);
        }

        @Test
        @DisplayName("TC-PARSE-006: function call arguments")
        void testFunctionCall() {
            FunctionSyntax call = (FunctionSyntax) branch("/count(school?campus='old')");

            assertThat(call.identifier().value()).isEqualTo("count");
            assertThat(call.arguments()).hasSize(1);
            assertThat(call.arguments().get(0)).isInstanceOf(SieveSyntax.class);
        }

        @Test
        @DisplayName("TC-PARSE-007: a trailing sign is a direction decorator")
        void testDirection() {
            SelectorSyntax selector = (SelectorSyntax) branch("/school{name-, code}");

            OperatorSyntax direction = (OperatorSyntax) selector.rbranches().get(0);
            assertThat(direction.symbol()).isEqualTo("-");
            assertThat(direction.rbranch()).isNull();
            assertThat(direction.name()).isEqualTo("_-");
        }

        @Test
        @DisplayName("TC-PARSE-008: a trailing slash starts a format command")
        void testCommand() {
            Syntax root = branch("/school/:json");

            assertThat(root).isInstanceOf(CommandSyntax.class);
            CommandSyntax command = (CommandSyntax) root;
            assertThat(command.identifier().value()).isEqualTo("json");
            assertThat(command.lbranch().branch()).isInstanceOf(IdentifierSyntax.class);
        }

        @Test
        @DisplayName("TC-PARSE-009: a slash between terms is a division")
        void testDivision() {
            OperatorSyntax root = (OperatorSyntax) branch("/6/3");

            assertThat(root.symbol()).isEqualTo("/");
        }

        @Test
        @DisplayName("TC-PARSE-010: locator and wildcard")
        void testLocatorAndWildcard() {
            SelectorSyntax selector = (SelectorSyntax) branch("/course[astro.101]{*2}");

            assertThat(selector.lbranch()).isInstanceOf(LocatorSyntax.class);
            LocatorSyntax locator = (LocatorSyntax) selector.lbranch();
            assertThat(locator.rbranch().branches()).hasSize(2);
            WildcardSyntax wildcard = (WildcardSyntax) selector.rbranches().get(0);
            assertThat(wildcard.index().value()).isEqualTo("2");
        }

        @ParameterizedTest(name = "TC-PARSE-011: {0} survives rendering")
        @ValueSource(strings = {
            "/school{code, name}?campus='old'",
            "/school{name, count(department)}",
            "/course?credits>3&!(title~'x')",
            "/department{name, school.name}/:csv",
            "/school.sort(name-).limit(10, 20)",
            "/{'it''s', -1, 2.5e-1}"
        })
        void testRendering(String query) {
            QuerySyntax syntax = QueryParser.parse(query);

            assertThat(QueryParser.parse(syntax.toString())).isEqualTo(syntax);
        }
    }

    @Nested
    @DisplayName("Marks")
    class Marks {

        @Test
        @DisplayName("TC-PARSE-012: identifier marks cover exactly the name")
        void testIdentifierMark() {
            SelectorSyntax selector = (SelectorSyntax) branch("/{nosuchcolumn}");

            Syntax identifier = selector.rbranches().get(0);
            assertThat(identifier.mark().start()).isEqualTo(2);
            assertThat(identifier.mark().end()).isEqualTo(14);
            assertThat(identifier.mark().text()).isEqualTo("nosuchcolumn");
        }

        @Test
        @DisplayName("TC-PARSE-013: operator marks span both operands")
        void testOperatorMark() {
            Syntax root = branch("/1 + 22");

            assertThat(root.mark().text()).isEqualTo("1 + 22");
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("TC-PARSE-014: query must start with a slash")
        void testMissingSlash() {
            assertThatThrownBy(() -> QueryParser.parse("school"))
                .isInstanceOf(ParseError.class)
                .hasMessage("query must start with symbol '/'");
        }

        @Test
        @DisplayName("TC-PARSE-015: unexpected symbol")
        void testUnexpectedSymbol() {
            ParseError error = catchThrowableOfType(() -> QueryParser.parse("/{1*}"), ParseError.class);

            assertThat(error).isNotNull();
            assertThat(error.detail()).isEqualTo("unexpected symbol '}'");
            assertThat(error.mark().start()).isEqualTo(4);
        }

        @Test
        @DisplayName("TC-PARSE-016: unexpected end of query")
        void testUnexpectedEnd() {
            assertThatThrownBy(() -> QueryParser.parse("/school?"))
                .isInstanceOf(ParseError.class)
                .hasMessage("unexpected end of query");
        }

        @Test
        @DisplayName("TC-PARSE-017: unclosed group")
        void testUnclosedGroup() {
            assertThatThrownBy(() -> QueryParser.parse("/(school"))
                .isInstanceOf(ParseError.class)
                .hasMessage("cannot find a matching ')'");
        }

        @Test
        @DisplayName("TC-PARSE-018: reference requires a name")
        void testReferenceWithoutName() {
            assertThatThrownBy(() -> QueryParser.parse("/{$1}"))
                .isInstanceOf(ParseError.class)
                .hasMessage("symbol '$' must be followed by an identifier");
        }

        @Test
        @DisplayName("TC-PARSE-019: trailing input")
        void testTrailingInput() {
            assertThatThrownBy(() -> QueryParser.parse("/school)"))
                .isInstanceOf(ParseError.class)
                .hasMessage("expected the end of query; got ')'");
        }
    }
}
