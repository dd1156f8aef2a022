package com.sievesql.parser;

import com.sievesql.exception.ParseError;
import com.sievesql.mark.Mark;
import com.sievesql.syntax.AssignmentSyntax;
import com.sievesql.syntax.CommandSyntax;
import com.sievesql.syntax.ComplementSyntax;
import com.sievesql.syntax.FunctionSyntax;
import com.sievesql.syntax.GroupSyntax;
import com.sievesql.syntax.HomeSyntax;
import com.sievesql.syntax.IdentifierSyntax;
import com.sievesql.syntax.LinkSyntax;
import com.sievesql.syntax.LocationSyntax;
import com.sievesql.syntax.LocatorSyntax;
import com.sievesql.syntax.MappingSyntax;
import com.sievesql.syntax.NumberSyntax;
import com.sievesql.syntax.OperatorSyntax;
import com.sievesql.syntax.QuerySyntax;
import com.sievesql.syntax.QuotientSyntax;
import com.sievesql.syntax.ReferenceSyntax;
import com.sievesql.syntax.SegmentSyntax;
import com.sievesql.syntax.SelectorSyntax;
import com.sievesql.syntax.SieveSyntax;
import com.sievesql.syntax.SpecifierSyntax;
import com.sievesql.syntax.StringSyntax;
import com.sievesql.syntax.Syntax;
import com.sievesql.syntax.UnquotedStringSyntax;
import com.sievesql.syntax.WildcardSyntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser of queries.
 *
 * <p>Grammar, from the loosest binding to the tightest:
 * <pre>
 *   input       ::= segment END
 *   segment     ::= '/' ( top command* )?
 *   command     ::= '/' ':' identifier ( '/' top? | call | flow )?
 *   top         ::= flow ( direction | mapping )*
 *   direction   ::= '+' | '-'
 *   mapping     ::= ':' identifier ( flow | call )?
 *   flow        ::= disjunction ( sieve | quotient | selection )*
 *   sieve       ::= '?' disjunction
 *   quotient    ::= '^' disjunction
 *   selection   ::= selector ( '.' atom )*
 *   disjunction ::= conjunction ( '|' conjunction )*
 *   conjunction ::= negation ( '&amp;' negation )*
 *   negation    ::= '!' negation | comparison
 *   comparison  ::= expression ( ( '~' | '!~' | '&lt;=' | '&lt;' | '&gt;=' | '&gt;' |
 *                                  '==' | '=' | '!==' | '!=' ) expression )?
 *   expression  ::= term ( ( '+' | '-' ) term )*
 *   term        ::= factor ( ( '*' | '/' ) factor )*
 *   factor      ::= ( '+' | '-' ) factor | pointer
 *   pointer     ::= specifier ( link | assignment )?
 *   link        ::= '-&gt;' flow
 *   assignment  ::= ':=' top
 *   specifier   ::= locator ( '.' locator )*
 *   locator     ::= atom location?
 *   location    ::= '[' label ( '.' label )* ']'
 *   label       ::= STRING | LABEL | location | '(' label ( '.' label )* ')'
 *   atom        ::= '@' atom | '*' NUMBER? | '^' | selector | group |
 *                   identifier call? | reference | literal
 *   call        ::= '(' arguments? ')'
 *   selector    ::= '{' arguments? '}'
 *   arguments   ::= argument ( ',' argument )* ','?
 *   argument    ::= segment | top
 *   group       ::= '(' ( segment | top ) ')'
 *   reference   ::= '$' identifier
 * </pre>
 *
 * <p>Two ambiguities are resolved by looking ahead:
 * <ul>
 *   <li>a {@code +} or {@code -} after an expression is a direction
 *       decorator, not an arithmetic operator, when the run of {@code +}
 *       and {@code -} symbols it starts is followed by {@code :}, {@code ,},
 *       {@code )}, {@code &#125;}, {@code /} or the end of the query;</li>
 *   <li>a {@code /} after a term is a division unless it is followed by
 *       {@code :}, {@code ,}, {@code )}, {@code &#125;} or the end of the
 *       query, in which case it separates a command or ends a segment.</li>
 * </ul>
 */
public final class QueryParser {

    private static final List<String> SLASH = List.of("/");
    private static final List<String> TERMINATORS = List.of(",", ")", "}");
    private static final List<String> ARGUMENT_TERMINATORS = List.of(":", ",", ")", "}");
    private static final List<String> DIRECTION_TERMINATORS = List.of(":", ",", ")", "}", "/");
    private static final List<String> SIGNS = List.of("+", "-");
    private static final List<String> COMPARISONS =
        List.of("~", "!~", "<=", "<", ">=", ">", "==", "=", "!==", "!=");

    private final TokenStream tokens;

    private QueryParser(TokenStream tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a query.
     *
     * @param input the query text
     * @return the syntax tree
     * @throws com.sievesql.exception.ScanError if the query cannot be tokenized
     * @throws ParseError if the query is not well-formed
     */
    public static QuerySyntax parse(String input) {
        QueryParser parser = new QueryParser(Scanner.scan(input));
        SegmentSyntax segment = parser.segment();
        parser.end();
        return new QuerySyntax(segment, segment.mark());
    }

    private void end() {
        if (tokens.peek(TokenKind.END, null, 0, true, false) == null) {
            Token token = tokens.pop();
            throw new ParseError("expected the end of query; got '" + token.value() + "'", token.mark());
        }
    }

    private boolean atTerminator() {
        return tokens.peek(TokenKind.END) || tokens.peek(TokenKind.SYMBOL, TERMINATORS);
    }

    private SegmentSyntax segment() {
        Token headToken = tokens.peek(TokenKind.SYMBOL, SLASH, 0, true, false);
        if (headToken == null) {
            Token token = tokens.pop();
            throw new ParseError("query must start with symbol '/'", token.mark());
        }
        Syntax branch = null;
        if (!atTerminator()) {
            branch = top();
            while (tokens.peek(TokenKind.SYMBOL, SLASH)) {
                Token tailToken = tokens.pop(TokenKind.SYMBOL, SLASH);
                if (atTerminator()) {
                    continue;
                }
                if (tokens.peek(TokenKind.SYMBOL, List.of(":"), 0, true, false) == null
                        || !tokens.peek(TokenKind.NAME)) {
                    throw new ParseError("symbol '/' must be followed by ':' and an identifier",
                                         tailToken.mark());
                }
                SegmentSyntax lbranch = new SegmentSyntax(branch, Mark.union(headToken, branch));
                IdentifierSyntax identifier = identifier();
                List<Syntax> rbranches = new ArrayList<>();
                Object last = identifier;
                if (!atTerminator()) {
                    if (tokens.peek(TokenKind.SYMBOL, SLASH)) {
                        if (!tokens.peek(TokenKind.SYMBOL, List.of(":"), 1)) {
                            Token rbranchToken = tokens.pop(TokenKind.SYMBOL, SLASH);
                            Syntax rbranch = null;
                            if (!atTerminator()) {
                                rbranch = top();
                            }
                            rbranches.add(new SegmentSyntax(rbranch, Mark.union(rbranchToken, rbranch)));
                        }
                    } else if (tokens.peek(TokenKind.SYMBOL, List.of("("))) {
                        Token openToken = tokens.pop(TokenKind.SYMBOL, List.of("("));
                        rbranches.addAll(arguments(openToken, ")"));
                        last = tokens.pop(TokenKind.SYMBOL, List.of(")"));
                    } else {
                        rbranches.add(flow());
                    }
                }
                branch = new CommandSyntax(identifier, lbranch, rbranches,
                                           Mark.union(lbranch, identifier, last, rbranches));
            }
        }
        return new SegmentSyntax(branch, Mark.union(headToken, branch));
    }

    /**
     * Parses comma-separated arguments up to, but not including, the closing symbol.
     */
    private List<Syntax> arguments(Token openToken, String close) {
        List<Syntax> branches = new ArrayList<>();
        List<String> closing = List.of(close);
        while (!tokens.peek(TokenKind.SYMBOL, closing)) {
            Syntax branch = tokens.peek(TokenKind.SYMBOL, SLASH) ? segment() : top();
            branches.add(branch);
            if (tokens.peek(TokenKind.SYMBOL, List.of(","))) {
                tokens.pop(TokenKind.SYMBOL, List.of(","));
            } else if (!tokens.peek(TokenKind.SYMBOL, closing)) {
                throw new ParseError("cannot find a matching '" + close + "'", Mark.union(openToken, branches));
            }
        }
        return branches;
    }

    private Syntax top() {
        Syntax top = flow();
        while (tokens.peek(TokenKind.SYMBOL, List.of("+", "-", ":"))) {
            if (tokens.peek(TokenKind.SYMBOL, SIGNS)) {
                Token symbolToken = tokens.pop(TokenKind.SYMBOL, SIGNS);
                top = new OperatorSyntax(symbolToken.value(), top, null, Mark.union(top, symbolToken));
                continue;
            }
            Token symbolToken = tokens.pop(TokenKind.SYMBOL, List.of(":"));
            if (!tokens.peek(TokenKind.NAME)) {
                throw new ParseError("symbol ':' must be followed by an identifier", symbolToken.mark());
            }
            IdentifierSyntax identifier = identifier();
            List<Syntax> rbranches = new ArrayList<>();
            Mark mark;
            if (tokens.peek(TokenKind.SYMBOL, List.of("("))) {
                Token openToken = tokens.pop(TokenKind.SYMBOL, List.of("("));
                rbranches.addAll(arguments(openToken, ")"));
                Token tailToken = tokens.pop(TokenKind.SYMBOL, List.of(")"));
                mark = Mark.union(top, tailToken);
            } else {
                int ahead = 0;
                while (tokens.peek(TokenKind.SYMBOL, SIGNS, ahead)) {
                    ahead++;
                }
                if (tokens.peek(TokenKind.SYMBOL, SLASH, ahead)) {
                    ahead++;
                }
                if (!(tokens.peek(TokenKind.SYMBOL, ARGUMENT_TERMINATORS, ahead)
                        || tokens.peek(TokenKind.END, null, ahead))) {
                    rbranches.add(flow());
                }
                mark = Mark.union(top, identifier, rbranches);
            }
            top = new MappingSyntax(identifier, top, rbranches, mark);
        }
        return top;
    }

    private Syntax flow() {
        Syntax flow = disjunction();
        while (tokens.peek(TokenKind.SYMBOL, List.of("?", "^", "{"))) {
            if (tokens.peek(TokenKind.SYMBOL, List.of("?"), 0, true, false) != null) {
                Syntax rbranch = disjunction();
                flow = new SieveSyntax(flow, rbranch, Mark.union(flow, rbranch));
            } else if (tokens.peek(TokenKind.SYMBOL, List.of("^"), 0, true, false) != null) {
                Syntax rbranch = disjunction();
                flow = new QuotientSyntax(flow, rbranch, Mark.union(flow, rbranch));
            } else {
                Token openToken = tokens.pop(TokenKind.SYMBOL, List.of("{"));
                List<Syntax> rbranches = arguments(openToken, "}");
                Token tailToken = tokens.pop(TokenKind.SYMBOL, List.of("}"));
                flow = new SelectorSyntax(flow, rbranches, Mark.union(flow, tailToken));
                while (tokens.peek(TokenKind.SYMBOL, List.of("."), 0, true, false) != null) {
                    Syntax rbranch = atom();
                    flow = new SpecifierSyntax(flow, rbranch, Mark.union(flow, rbranch));
                }
            }
        }
        return flow;
    }

    private Syntax disjunction() {
        Syntax test = conjunction();
        while (tokens.peek(TokenKind.SYMBOL, List.of("|"))) {
            Token symbolToken = tokens.pop(TokenKind.SYMBOL, List.of("|"));
            Syntax rbranch = conjunction();
            test = new OperatorSyntax(symbolToken.value(), test, rbranch, Mark.union(test, rbranch));
        }
        return test;
    }

    private Syntax conjunction() {
        Syntax test = negation();
        while (tokens.peek(TokenKind.SYMBOL, List.of("&"))) {
            Token symbolToken = tokens.pop(TokenKind.SYMBOL, List.of("&"));
            Syntax rbranch = negation();
            test = new OperatorSyntax(symbolToken.value(), test, rbranch, Mark.union(test, rbranch));
        }
        return test;
    }

    private Syntax negation() {
        List<Token> symbolTokens = new ArrayList<>();
        while (tokens.peek(TokenKind.SYMBOL, List.of("!"))) {
            symbolTokens.add(tokens.pop(TokenKind.SYMBOL, List.of("!")));
        }
        Syntax test = comparison();
        for (int i = symbolTokens.size() - 1; i >= 0; i--) {
            Token symbolToken = symbolTokens.get(i);
            test = new OperatorSyntax(symbolToken.value(), null, test, Mark.union(symbolToken, test));
        }
        return test;
    }

    private Syntax comparison() {
        Syntax expression = expression();
        Token symbolToken = tokens.peek(TokenKind.SYMBOL, COMPARISONS, 0, true, false);
        if (symbolToken == null) {
            return expression;
        }
        Syntax rbranch = expression();
        return new OperatorSyntax(symbolToken.value(), expression, rbranch, Mark.union(expression, rbranch));
    }

    private Syntax expression() {
        Syntax expression = term();
        while (tokens.peek(TokenKind.SYMBOL, SIGNS)) {
            int ahead = 1;
            while (tokens.peek(TokenKind.SYMBOL, SIGNS, ahead)) {
                ahead++;
            }
            if (tokens.peek(TokenKind.SYMBOL, DIRECTION_TERMINATORS, ahead)
                    || tokens.peek(TokenKind.END, null, ahead)) {
                break;
            }
            Token symbolToken = tokens.pop(TokenKind.SYMBOL, SIGNS);
            Syntax rbranch = term();
            expression = new OperatorSyntax(symbolToken.value(), expression, rbranch,
                                            Mark.union(expression, rbranch));
        }
        return expression;
    }

    private Syntax term() {
        Syntax term = factor();
        while (tokens.peek(TokenKind.SYMBOL, List.of("*"))
                || (tokens.peek(TokenKind.SYMBOL, SLASH)
                    && !(tokens.peek(TokenKind.END, null, 1)
                         || tokens.peek(TokenKind.SYMBOL, ARGUMENT_TERMINATORS, 1)))) {
            Token symbolToken = tokens.pop(TokenKind.SYMBOL, List.of("*", "/"));
            Syntax rbranch = factor();
            term = new OperatorSyntax(symbolToken.value(), term, rbranch, Mark.union(term, rbranch));
        }
        return term;
    }

    private Syntax factor() {
        List<Token> symbolTokens = new ArrayList<>();
        while (tokens.peek(TokenKind.SYMBOL, SIGNS)) {
            symbolTokens.add(tokens.pop(TokenKind.SYMBOL, SIGNS));
        }
        Syntax factor = pointer();
        for (int i = symbolTokens.size() - 1; i >= 0; i--) {
            Token symbolToken = symbolTokens.get(i);
            factor = new OperatorSyntax(symbolToken.value(), null, factor, Mark.union(symbolToken, factor));
        }
        return factor;
    }

    private Syntax pointer() {
        Syntax pointer = specifier();
        if (tokens.peek(TokenKind.SYMBOL, List.of("->"), 0, true, false) != null) {
            Syntax rbranch = flow();
            return new LinkSyntax(pointer, rbranch, Mark.union(pointer, rbranch));
        }
        if (tokens.peek(TokenKind.SYMBOL, List.of(":="), 0, true, false) != null) {
            Syntax rbranch = top();
            return new AssignmentSyntax(pointer, rbranch, Mark.union(pointer, rbranch));
        }
        return pointer;
    }

    private Syntax specifier() {
        Syntax specifier = locator();
        while (tokens.peek(TokenKind.SYMBOL, List.of("."))) {
            tokens.pop(TokenKind.SYMBOL, List.of("."));
            Syntax rbranch = locator();
            specifier = new SpecifierSyntax(specifier, rbranch, Mark.union(specifier, rbranch));
        }
        return specifier;
    }

    private Syntax locator() {
        Syntax locator = atom();
        if (tokens.peek(TokenKind.SYMBOL, List.of("["))) {
            LocationSyntax location = location();
            locator = new LocatorSyntax(locator, location, Mark.union(locator, location));
        }
        return locator;
    }

    private LocationSyntax location() {
        Token openToken = tokens.pop(TokenKind.SYMBOL, List.of("[", "("));
        List<Syntax> labels = new ArrayList<>();
        labels.add(label());
        while (tokens.peek(TokenKind.SYMBOL, List.of("."))) {
            tokens.pop(TokenKind.SYMBOL, List.of("."));
            labels.add(label());
        }
        String close = openToken.value().equals("[") ? "]" : ")";
        if (!tokens.peek(TokenKind.SYMBOL, List.of(close))) {
            throw new ParseError("cannot find a matching '" + close + "'", Mark.union(openToken, labels));
        }
        Token closeToken = tokens.pop(TokenKind.SYMBOL, List.of(close));
        return new LocationSyntax(labels, Mark.union(openToken, closeToken));
    }

    private Syntax label() {
        if (tokens.peek(TokenKind.LABEL)) {
            Token token = tokens.pop(TokenKind.LABEL);
            return new UnquotedStringSyntax(token.value(), token.mark());
        }
        if (tokens.peek(TokenKind.STRING)) {
            Token token = tokens.pop(TokenKind.STRING);
            return new StringSyntax(token.value(), token.mark());
        }
        if (tokens.peek(TokenKind.SYMBOL, List.of("[", "("))) {
            return location();
        }
        throw unexpected();
    }

    private Syntax atom() {
        if (tokens.peek(TokenKind.SYMBOL, List.of("@"))) {
            Token symbolToken = tokens.pop(TokenKind.SYMBOL, List.of("@"));
            Syntax atom = atom();
            return new HomeSyntax(atom, Mark.union(symbolToken, atom));
        }
        if (tokens.peek(TokenKind.SYMBOL, List.of("*"))) {
            Token symbolToken = tokens.pop(TokenKind.SYMBOL, List.of("*"));
            NumberSyntax index = null;
            if (tokens.peek(TokenKind.NUMBER)) {
                Token indexToken = tokens.pop(TokenKind.NUMBER);
                index = new NumberSyntax(indexToken.value(), indexToken.mark());
            }
            return new WildcardSyntax(index, Mark.union(symbolToken, index));
        }
        if (tokens.peek(TokenKind.SYMBOL, List.of("^"))) {
            Token symbolToken = tokens.pop(TokenKind.SYMBOL, List.of("^"));
            return new ComplementSyntax(symbolToken.mark());
        }
        if (tokens.peek(TokenKind.SYMBOL, List.of("("))) {
            return group();
        }
        if (tokens.peek(TokenKind.SYMBOL, List.of("{"))) {
            Token headToken = tokens.pop(TokenKind.SYMBOL, List.of("{"));
            List<Syntax> branches = arguments(headToken, "}");
            Token tailToken = tokens.pop(TokenKind.SYMBOL, List.of("}"));
            return new SelectorSyntax(null, branches, Mark.union(headToken, tailToken));
        }
        if (tokens.peek(TokenKind.NAME)) {
            IdentifierSyntax identifier = identifier();
            if (!tokens.peek(TokenKind.SYMBOL, List.of("("))) {
                return identifier;
            }
            Token openToken = tokens.pop(TokenKind.SYMBOL, List.of("("));
            List<Syntax> branches = arguments(openToken, ")");
            Token tailToken = tokens.pop(TokenKind.SYMBOL, List.of(")"));
            return new FunctionSyntax(identifier, branches, Mark.union(identifier, tailToken));
        }
        if (tokens.peek(TokenKind.SYMBOL, List.of("$"))) {
            Token headToken = tokens.pop(TokenKind.SYMBOL, List.of("$"));
            if (!tokens.peek(TokenKind.NAME)) {
                throw new ParseError("symbol '$' must be followed by an identifier", headToken.mark());
            }
            IdentifierSyntax identifier = identifier();
            return new ReferenceSyntax(identifier, Mark.union(headToken, identifier));
        }
        if (tokens.peek(TokenKind.STRING)) {
            Token token = tokens.pop(TokenKind.STRING);
            return new StringSyntax(token.value(), token.mark());
        }
        if (tokens.peek(TokenKind.NUMBER)) {
            Token token = tokens.pop(TokenKind.NUMBER);
            return new NumberSyntax(token.value(), token.mark());
        }
        throw unexpected();
    }

    private ParseError unexpected() {
        Token token = tokens.pop();
        if (token.kind() == TokenKind.END) {
            return new ParseError("unexpected end of query", token.mark());
        }
        return new ParseError("unexpected symbol '" + token.value() + "'", token.mark());
    }

    private GroupSyntax group() {
        Token headToken = tokens.pop(TokenKind.SYMBOL, List.of("("));
        Syntax branch = tokens.peek(TokenKind.SYMBOL, SLASH) ? segment() : top();
        Token tailToken = tokens.peek(TokenKind.SYMBOL, List.of(")"), 0, true, false);
        if (tailToken == null) {
            throw new ParseError("cannot find a matching ')'", Mark.union(headToken, branch));
        }
        return new GroupSyntax(branch, Mark.union(headToken, tailToken));
    }

    private IdentifierSyntax identifier() {
        Token nameToken = tokens.pop(TokenKind.NAME);
        return new IdentifierSyntax(nameToken.value(), nameToken.mark());
    }
}
