package com.sievesql.functions;

import com.sievesql.binding.AttributeKey;
import com.sievesql.types.BooleanDomain;
import com.sievesql.types.DateDomain;
import com.sievesql.types.DateTimeDomain;
import com.sievesql.types.DecimalDomain;
import com.sievesql.types.Domain;
import com.sievesql.types.FloatDomain;
import com.sievesql.types.IntegerDomain;
import com.sievesql.types.TextDomain;
import com.sievesql.types.TimeDomain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Registry of the functions and operators available in queries.
 *
 * <p>A function is registered under a name and an arity. The arity is
 * either exact, {@link #ANY_ARITY} for a call with any number of arguments,
 * or null for the bare form {@code name} without parentheses, which only
 * the literals {@code null}, {@code true} and {@code false} have. A call
 * first looks for its exact arity, then for {@link #ANY_ARITY}.
 *
 * <p>Operators are registered by their symbol; prefix operators as
 * {@code op_} and postfix operators as {@code _op}.
 *
 * <p>Function categories:
 * <ul>
 *   <li>Literals and scopes: null, true, false, root, this, home, id</li>
 *   <li>Navigation: distinct, as, filter, select, moniker, limit, sort, define, where</li>
 *   <li>Casts and constructors: boolean, string, integer, decimal, float, date, time, datetime, today, now</li>
 *   <li>Predicates: =, !=, ==, !==, &amp;, |, !, &lt;, &lt;=, &gt;, &gt;=, is_null, null_if, if_null, if, switch</li>
 *   <li>Arithmetic and strings: +, -, *, /, round, trunc, length, ~, head, tail, slice, at, replace, upper,
 *       lower, trim</li>
 *   <li>Date parts: year, month, day, hour, minute, second</li>
 *   <li>Aggregates: exists, every, count, min, max, sum, avg</li>
 *   <li>Output formats: txt, html, raw, json, csv, tsv, xml, sql, default</li>
 * </ul>
 */
public final class FunctionRegistry {

    /** Arity of an entry that accepts any number of arguments. */
    public static final int ANY_ARITY = -1;

    /** Names of the output formats, usable as {@code /query/:format}. */
    public static final Set<String> FORMATS =
        Set.of("default", "txt", "html", "raw", "json", "csv", "tsv", "xml", "sql");

    private final Map<AttributeKey, FunctionBinder> binders = new LinkedHashMap<>();
    private final CorrelationTable correlations;

    public FunctionRegistry(CorrelationTable correlations) {
        this.correlations = Objects.requireNonNull(correlations, "correlations must not be null");
    }

    /**
     * Creates a registry with all built-in functions.
     */
    public static FunctionRegistry builtins() {
        FunctionRegistry registry = new FunctionRegistry(CorrelationTable.builtins());
        registry.initializeLiterals();
        registry.initializeNavigation();
        registry.initializeCasts();
        registry.initializePredicates();
        registry.initializeArithmetic();
        registry.initializeStrings();
        registry.initializeDates();
        registry.initializeAggregates();
        registry.initializeFormats();
        return registry;
    }

    /**
     * Registers a binder; a later registration under the same key replaces
     * the earlier one.
     */
    public FunctionRegistry register(String name, Integer arity, FunctionBinder binder) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(binder, "binder must not be null");
        binders.put(new AttributeKey(name.toLowerCase(Locale.ROOT), arity), binder);
        return this;
    }

    public FunctionRegistry register(String name, FunctionBinder binder) {
        return register(name, ANY_ARITY, binder);
    }

    /**
     * Finds the binder of a call.
     *
     * @param name the function name or operator symbol
     * @param arity the number of arguments, or null for a bare identifier
     * @return the binder, or null if there is none
     */
    public FunctionBinder find(String name, Integer arity) {
        String key = name.toLowerCase(Locale.ROOT);
        FunctionBinder binder = binders.get(new AttributeKey(key, arity));
        if (binder == null && arity != null) {
            binder = binders.get(new AttributeKey(key, ANY_ARITY));
        }
        return binder;
    }

    /**
     * Returns the registered names with their arities.
     */
    public Set<AttributeKey> names() {
        return Collections.unmodifiableSet(binders.keySet());
    }

    public CorrelationTable correlations() {
        return correlations;
    }

    public int size() {
        return binders.size();
    }

    // ==================== Literals and scopes ====================

    private void initializeLiterals() {
        for (Integer arity : new Integer[] {ANY_ARITY, null}) {
            register("null", arity, new MacroBinder(Signature.of(SignatureKind.NULLARY), Macros::nullValue));
            register("true", arity, new MacroBinder(Signature.of(SignatureKind.NULLARY), Macros.booleanValue(true)));
            register("false", arity,
                    new MacroBinder(Signature.of(SignatureKind.NULLARY), Macros.booleanValue(false)));
        }
        register("root", new MacroBinder(Signature.of(SignatureKind.NULLARY), Macros::root));
        register("this", new MacroBinder(Signature.of(SignatureKind.NULLARY), Macros::self));
        register("home", new MacroBinder(Signature.of(SignatureKind.NULLARY), Macros::home));
        register("id", new MacroBinder(Signature.of(SignatureKind.NULLARY), Macros::id));
    }

    // ==================== Navigation ====================

    private void initializeNavigation() {
        register("distinct", new MacroBinder(Signature.of(SignatureKind.UNARY), Macros::distinct));
        register("as", new MacroBinder(Signature.of(SignatureKind.AS), Macros::title));
        register("filter", new MacroBinder(Signature.of(SignatureKind.UNARY), Macros::filter));
        register("select", new MacroBinder(Signature.of(SignatureKind.SELECT), Macros::select));
        register("moniker", new MacroBinder(Signature.of(SignatureKind.LINK), Macros::moniker));
        register("_+", new MacroBinder(Signature.polar(SignatureKind.SORT_DIRECTION, 1), Macros.direction(1)));
        register("_-", new MacroBinder(Signature.polar(SignatureKind.SORT_DIRECTION, -1), Macros.direction(-1)));
        register("limit", new MacroBinder(Signature.of(SignatureKind.LIMIT), Macros::limit));
        register("sort", new MacroBinder(Signature.of(SignatureKind.SORT), Macros::sort));
        register("define", new MacroBinder(Signature.of(SignatureKind.DEFINE), Macros::define));
        register("where", new MacroBinder(Signature.of(SignatureKind.WHERE), Macros::where));
    }

    // ==================== Casts and constructors ====================

    private void initializeCasts() {
        registerCast(new BooleanDomain(), "boolean", "bool");
        registerCast(new TextDomain(), "string", "str");
        registerCast(new IntegerDomain(), "integer", "int");
        registerCast(new DecimalDomain(), "decimal", "dec");
        registerCast(new FloatDomain(), "float");
        registerCast(new DateDomain(), "date");
        registerCast(new TimeDomain(), "time");
        registerCast(new DateTimeDomain(), "datetime");

        Domain integer = new IntegerDomain();
        register("date", 3, new MonoFunctionBinder(Signature.of(SignatureKind.MAKE_DATE),
                List.of(integer, integer, integer), new DateDomain()));
        MonoFunctionBinder makeDateTime = new MonoFunctionBinder(Signature.of(SignatureKind.MAKE_DATETIME),
                List.of(integer, integer, integer, integer, integer, new FloatDomain()), new DateTimeDomain());
        for (int arity = 3; arity <= 6; arity++) {
            register("datetime", arity, makeDateTime);
        }
        register("datetime", 2, new MonoFunctionBinder(Signature.of(SignatureKind.COMBINE_DATETIME),
                List.of(new DateDomain(), new TimeDomain()), new DateTimeDomain()));
        register("today", new MonoFunctionBinder(Signature.of(SignatureKind.TODAY), List.of(), new DateDomain()));
        register("now", new MonoFunctionBinder(Signature.of(SignatureKind.NOW), List.of(), new DateTimeDomain()));
    }

    private void registerCast(Domain domain, String... names) {
        CastBinder binder = new CastBinder(domain);
        for (String name : names) {
            register(name, binder);
        }
    }

    // ==================== Predicates ====================

    private void initializePredicates() {
        Signature nary = Signature.of(SignatureKind.NARY);
        Signature binary = Signature.of(SignatureKind.BINARY);
        register("=", new CustomFunctionBinder(nary, Predicates.among(1)));
        register("!=", new CustomFunctionBinder(nary, Predicates.among(-1)));
        register("==", new CustomFunctionBinder(binary, Predicates.totallyEqual(1)));
        register("!==", new CustomFunctionBinder(binary, Predicates.totallyEqual(-1)));
        register("&", new CustomFunctionBinder(binary, Predicates.connective(SignatureKind.AND)));
        register("|", new CustomFunctionBinder(binary, Predicates.connective(SignatureKind.OR)));
        register("!_", new CustomFunctionBinder(Signature.of(SignatureKind.UNARY), Predicates::not));
        for (String relation : List.of("<", "<=", ">", ">=")) {
            register(relation, new CustomFunctionBinder(binary, Predicates.compare(relation)));
        }
        register("is_null", new HomoFunctionBinder(Signature.polar(SignatureKind.IS_NULL, 1), new BooleanDomain()));
        register("null_if", new HomoFunctionBinder(Signature.of(SignatureKind.NULL_IF)));
        register("if_null", new HomoFunctionBinder(Signature.of(SignatureKind.IF_NULL)));
        register("if", ConditionalBinder.ifThen());
        register("switch", ConditionalBinder.switchCase());
    }

    // ==================== Arithmetic ====================

    private void initializeArithmetic() {
        registerPoly("+", SignatureKind.ADD);
        registerPoly("-", SignatureKind.SUBTRACT);
        registerPoly("*", SignatureKind.MULTIPLY);
        registerPoly("/", SignatureKind.DIVIDE);
        registerPoly("+_", SignatureKind.KEEP_POLARITY);
        registerPoly("-_", SignatureKind.REVERSE_POLARITY);
        registerPoly("round", SignatureKind.ROUND);
        register("round", 2, new PolyFunctionBinder(Signature.of(SignatureKind.ROUND_TO), correlations));
        registerPoly("trunc", SignatureKind.TRUNC);
        register("trunc", 2, new PolyFunctionBinder(Signature.of(SignatureKind.TRUNC_TO), correlations));
    }

    private void registerPoly(String name, SignatureKind kind, String... integerSlots) {
        register(name, new PolyFunctionBinder(Signature.of(kind), correlations, Set.of(integerSlots)));
    }

    // ==================== Strings ====================

    private void initializeStrings() {
        registerPoly("length", SignatureKind.LENGTH);
        register("~", new PolyFunctionBinder(Signature.polar(SignatureKind.CONTAINS, 1), correlations));
        register("!~", new PolyFunctionBinder(Signature.polar(SignatureKind.CONTAINS, -1), correlations));
        registerPoly("head", SignatureKind.HEAD, "length");
        registerPoly("tail", SignatureKind.TAIL, "length");
        registerPoly("slice", SignatureKind.SLICE, "left", "right");
        registerPoly("at", SignatureKind.AT, "index", "length");
        registerPoly("replace", SignatureKind.REPLACE);
        registerPoly("upper", SignatureKind.UPPER);
        registerPoly("lower", SignatureKind.LOWER);
        registerPoly("trim", SignatureKind.TRIM);
        registerPoly("ltrim", SignatureKind.LTRIM);
        registerPoly("rtrim", SignatureKind.RTRIM);
    }

    // ==================== Date parts ====================

    private void initializeDates() {
        registerPoly("year", SignatureKind.EXTRACT_YEAR);
        registerPoly("month", SignatureKind.EXTRACT_MONTH);
        registerPoly("day", SignatureKind.EXTRACT_DAY);
        registerPoly("hour", SignatureKind.EXTRACT_HOUR);
        registerPoly("minute", SignatureKind.EXTRACT_MINUTE);
        registerPoly("second", SignatureKind.EXTRACT_SECOND);
    }

    // ==================== Aggregates ====================

    private void initializeAggregates() {
        register("exists", AggregateBinder.quantify(1));
        register("every", AggregateBinder.quantify(-1));
        register("count", AggregateBinder.count());
        register("min", AggregateBinder.poly(Signature.polar(SignatureKind.MIN_MAX, 1), correlations));
        register("max", AggregateBinder.poly(Signature.polar(SignatureKind.MIN_MAX, -1), correlations));
        register("sum", AggregateBinder.poly(Signature.of(SignatureKind.SUM), correlations));
        register("avg", AggregateBinder.poly(Signature.of(SignatureKind.AVG), correlations));
    }

    // ==================== Output formats ====================

    private void initializeFormats() {
        for (String format : FORMATS) {
            register(format, new MacroBinder(Signature.of(SignatureKind.UNARY), Macros.format(format)));
        }
    }
}
