package com.sievesql.generator;

import com.sievesql.catalog.Table;
import com.sievesql.compiler.PaginationStrategy;
import com.sievesql.exception.SerializeError;
import com.sievesql.frame.Anchor;
import com.sievesql.frame.BranchFrame;
import com.sievesql.frame.CastPhrase;
import com.sievesql.frame.ColumnPhrase;
import com.sievesql.frame.EmbeddingPhrase;
import com.sievesql.frame.FormulaPhrase;
import com.sievesql.frame.Frame;
import com.sievesql.frame.LiteralPhrase;
import com.sievesql.frame.NestedFrame;
import com.sievesql.frame.Phrase;
import com.sievesql.frame.ReferencePhrase;
import com.sievesql.frame.ScalarFrame;
import com.sievesql.frame.SegmentFrame;
import com.sievesql.frame.TableFrame;
import com.sievesql.functions.SignatureKind;
import com.sievesql.types.BooleanDomain;
import com.sievesql.types.DateDomain;
import com.sievesql.types.DateTimeDomain;
import com.sievesql.types.DecimalDomain;
import com.sievesql.types.Domain;
import com.sievesql.types.EnumDomain;
import com.sievesql.types.FloatDomain;
import com.sievesql.types.IntegerDomain;
import com.sievesql.types.TextDomain;
import com.sievesql.types.TimeDomain;
import com.sievesql.types.UntypedDomain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;

/**
 * Renders a reduced frame tree as SQL text for one database backend.
 *
 * <p>The base class renders the standard SQL forms. Every rendering step
 * is a separate protected method so that a backend overrides only the
 * forms it writes differently:
 * <ul>
 *   <li>literals dispatch on the domain of the value;</li>
 *   <li>casts dispatch on the pair of source and target domains;</li>
 *   <li>formulas dispatch on the signature kind.</li>
 * </ul>
 *
 * <p>Formula templates refer to arguments by slot name: in
 * {@code "({lop} + {rop})"} each placeholder is replaced with the
 * rendering of the argument in that slot. {@code {not}} renders as
 * {@code "NOT "} for a formula of negative polarity.
 *
 * @see PostgresDialect
 * @see OracleDialect
 */
public abstract class Dialect {

    private static final BigInteger MIN_INTEGER = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger MAX_INTEGER = BigInteger.valueOf(Long.MAX_VALUE);

    /**
     * Returns the registry name of the dialect.
     */
    public abstract String name();

    /**
     * Returns the longest identifier the backend accepts.
     */
    public abstract int maxAliasLength();

    public abstract PaginationStrategy paginationStrategy();

    /**
     * Returns true if a Boolean value can be used as a condition and a
     * condition can be used as a value. When false, every conversion is
     * explicit and every {@code SELECT} needs a {@code FROM} clause.
     */
    public abstract boolean hasBooleanValues();

    @Override
    public String toString() {
        return name();
    }

    // ==================== Frames ====================

    public void dumpFrame(Frame frame, SerializationContext out) {
        if (frame instanceof TableFrame table) {
            dumpTable(table, out);
        } else if (frame instanceof ScalarFrame scalar) {
            dumpScalar(scalar, out);
        } else if (frame instanceof SegmentFrame segment) {
            dumpBranch(segment, out);
            out.newline();
        } else if (frame instanceof NestedFrame nested) {
            out.write("(");
            out.indent();
            dumpBranch(nested, out);
            out.dedent();
            out.write(")");
        } else {
            throw new SerializeError("unexpected frame " + frame, frame.mark());
        }
    }

    protected void dumpTable(TableFrame frame, SerializationContext out) {
        Table table = frame.table();
        if (table.schema() != null && table.schema().name() != null && !table.schema().name().isEmpty()) {
            out.name(table.schema().name(), frame).write(".");
        }
        out.name(table.name(), frame);
    }

    protected void dumpScalar(ScalarFrame frame, SerializationContext out) {
        out.write("(SELECT ");
        dumpBoolean(true, out);
        out.write(")");
    }

    protected void dumpBranch(BranchFrame frame, SerializationContext out) {
        dumpSelect(frame, out);
        dumpInclude(frame, out);
        dumpWhere(frame, out);
        dumpGroup(frame, out);
        dumpHaving(frame, out);
        dumpOrder(frame, out);
        dumpLimit(frame, out);
    }

    protected void dumpSelect(BranchFrame frame, SerializationContext out) {
        List<String> aliases = out.selectAliases(frame.tag());
        out.write("SELECT ");
        out.indent();
        List<Phrase> select = frame.select();
        for (int index = 0; index < select.size(); index++) {
            Phrase phrase = select.get(index);
            out.dump(phrase);
            if (out.withAliases()) {
                out.write(" AS ").name(aliases.get(index), phrase);
            }
            if (index < select.size() - 1) {
                out.write(",");
                out.newline();
            }
        }
        out.dedent();
    }

    protected void dumpInclude(BranchFrame frame, SerializationContext out) {
        if (frame.include().isEmpty()) {
            return;
        }
        out.newline();
        out.write("FROM ");
        out.indent();
        for (Anchor anchor : frame.include()) {
            out.dump(anchor);
        }
        out.dedent();
    }

    protected void dumpWhere(BranchFrame frame, SerializationContext out) {
        if (frame.where() == null) {
            return;
        }
        out.newline();
        out.write("WHERE ").dump(frame.where());
    }

    protected void dumpGroup(BranchFrame frame, SerializationContext out) {
        List<Phrase> group = frame.group().stream()
                .filter(phrase -> !(phrase instanceof LiteralPhrase))
                .toList();
        if (group.isEmpty()) {
            return;
        }
        out.newline();
        out.write("GROUP BY ");
        for (int index = 0; index < group.size(); index++) {
            Phrase phrase = group.get(index);
            int position = frame.select().indexOf(phrase);
            if (position >= 0) {
                out.write(String.valueOf(position + 1));
            } else {
                out.dump(phrase);
            }
            if (index < group.size() - 1) {
                out.write(", ");
            }
        }
    }

    protected void dumpHaving(BranchFrame frame, SerializationContext out) {
        if (frame.having() == null) {
            return;
        }
        out.newline();
        out.write("HAVING ").dump(frame.having());
    }

    protected void dumpOrder(BranchFrame frame, SerializationContext out) {
        if (frame.order().isEmpty()) {
            return;
        }
        out.newline();
        out.write("ORDER BY ");
        List<Phrase> order = frame.order();
        for (int index = 0; index < order.size(); index++) {
            FormulaPhrase item = (FormulaPhrase) order.get(index);
            Phrase phrase = item.get("base");
            int direction = item.signature().polarity();
            int position = frame.select().indexOf(phrase);
            if (position >= 0) {
                out.write(String.valueOf(position + 1));
            } else {
                out.dump(phrase);
            }
            out.write(direction > 0 ? " ASC" : " DESC");
            dumpNullsOrder(phrase, direction, out);
            if (index < order.size() - 1) {
                out.write(", ");
            }
        }
    }

    /**
     * Places {@code NULL}s before other values in ascending order and after
     * them in descending order. Both backends sort {@code NULL} as the
     * largest value unless told otherwise.
     */
    protected void dumpNullsOrder(Phrase phrase, int direction, SerializationContext out) {
        if (phrase.isNullable()) {
            out.write(direction > 0 ? " NULLS FIRST" : " NULLS LAST");
        }
    }

    protected void dumpLimit(BranchFrame frame, SerializationContext out) {
        if (frame.limit() != null) {
            out.newline();
            out.write("LIMIT " + frame.limit());
        }
        if (frame.offset() != null) {
            out.newline();
            out.write("OFFSET " + frame.offset());
        }
    }

    // ==================== Anchors ====================

    public void dumpAnchor(Anchor anchor, SerializationContext out) {
        String alias = out.frameAlias(anchor.frame().tag());
        if (!anchor.isLeading()) {
            out.newline();
            out.write(joinKeyword(anchor)).write(" ");
        }
        out.indent();
        out.pushWithAliases(true);
        out.dump(anchor.frame());
        out.popWithAliases();
        dumpFrameAlias(alias, anchor.frame(), out);
        if (anchor.condition() != null) {
            out.newline();
            out.write("ON ").dump(anchor.condition());
        }
        out.dedent();
    }

    protected void dumpFrameAlias(String alias, Frame frame, SerializationContext out) {
        out.write(" AS ").name(alias, frame);
    }

    protected static String joinKeyword(Anchor anchor) {
        if (anchor.isCross()) {
            return "CROSS JOIN";
        }
        if (anchor.isInner()) {
            return "INNER JOIN";
        }
        if (anchor.isLeft() && !anchor.isRight()) {
            return "LEFT OUTER JOIN";
        }
        if (anchor.isRight() && !anchor.isLeft()) {
            return "RIGHT OUTER JOIN";
        }
        return "FULL OUTER JOIN";
    }

    // ==================== Phrases ====================

    public void dumpPhrase(Phrase phrase, SerializationContext out) {
        if (phrase instanceof LiteralPhrase literal) {
            if (literal.value() == null) {
                out.write("NULL");
            } else {
                dumpLiteral(literal, out);
            }
        } else if (phrase instanceof CastPhrase cast) {
            dumpCast(cast, out);
        } else if (phrase instanceof FormulaPhrase formula) {
            dumpFormula(formula, out);
        } else if (phrase instanceof ColumnPhrase column) {
            out.name(out.frameAlias(column.tag()), column).write(".").name(column.column().name(), column);
        } else if (phrase instanceof ReferencePhrase reference) {
            String child = out.selectAliases(reference.tag()).get(reference.index());
            out.name(out.frameAlias(reference.tag()), reference).write(".").name(child, reference);
        } else if (phrase instanceof EmbeddingPhrase embedding) {
            out.pushWithAliases(false);
            out.dump(out.frame(embedding.tag()));
            out.popWithAliases();
        } else {
            throw new SerializeError("unexpected phrase " + phrase, phrase.mark());
        }
    }

    // ==================== Literals ====================

    protected void dumpLiteral(LiteralPhrase phrase, SerializationContext out) {
        Domain domain = phrase.domain();
        Object value = phrase.value();
        if (domain instanceof BooleanDomain) {
            dumpBoolean((Boolean) value, out);
        } else if (domain instanceof IntegerDomain) {
            dumpInteger(phrase, (BigInteger) value, out);
        } else if (domain instanceof DecimalDomain) {
            dumpDecimal((BigDecimal) value, out);
        } else if (domain instanceof FloatDomain) {
            double number = (Double) value;
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                throw new SerializeError("invalid float value", phrase.mark());
            }
            dumpFloat(number, out);
        } else if (domain instanceof TextDomain || domain instanceof EnumDomain || domain instanceof UntypedDomain) {
            dumpText(phrase, (String) value, out);
        } else if (domain instanceof DateDomain) {
            dumpTemporal(phrase, "DATE", value.toString(), out);
        } else if (domain instanceof TimeDomain) {
            dumpTemporal(phrase, "TIME", value.toString(), out);
        } else if (domain instanceof DateTimeDomain) {
            LocalDateTime dateTime = (LocalDateTime) value;
            dumpTemporal(phrase, "TIMESTAMP", dateTime.toLocalDate() + " " + dateTime.toLocalTime(), out);
        } else {
            throw new SerializeError("unable to serialize a value of type " + domain, phrase.mark());
        }
    }

    protected void dumpBoolean(boolean value, SerializationContext out) {
        out.write(value ? "(1 = 1)" : "(1 = 0)");
    }

    protected void dumpInteger(LiteralPhrase phrase, BigInteger value, SerializationContext out) {
        if (value.compareTo(MIN_INTEGER) < 0 || value.compareTo(MAX_INTEGER) > 0) {
            throw new SerializeError("invalid integer value", phrase.mark());
        }
        out.write(value.toString());
    }

    protected void dumpDecimal(BigDecimal value, SerializationContext out) {
        out.write(value.toPlainString());
    }

    protected void dumpFloat(double value, SerializationContext out) {
        out.write(Double.toString(value));
    }

    protected void dumpText(LiteralPhrase phrase, String value, SerializationContext out) {
        out.literal(value, phrase);
    }

    protected void dumpTemporal(LiteralPhrase phrase, String type, String value, SerializationContext out) {
        out.write(type).write(" ").literal(value, phrase);
    }

    // ==================== Casts ====================

    protected void dumpCast(CastPhrase phrase, SerializationContext out) {
        Domain domain = phrase.domain();
        if (domain instanceof IntegerDomain) {
            cast(phrase, "INTEGER", out);
        } else if (domain instanceof DecimalDomain) {
            cast(phrase, "DECIMAL", out);
        } else if (domain instanceof FloatDomain) {
            cast(phrase, "DOUBLE PRECISION", out);
        } else if (domain instanceof TextDomain) {
            cast(phrase, "CHARACTER VARYING", out);
        } else if (domain instanceof DateDomain) {
            cast(phrase, "DATE", out);
        } else if (domain instanceof TimeDomain) {
            cast(phrase, "TIME", out);
        } else if (domain instanceof DateTimeDomain) {
            cast(phrase, "TIMESTAMP", out);
        } else {
            throw new SerializeError("unable to convert a value to " + domain, phrase.mark());
        }
    }

    protected static void cast(CastPhrase phrase, String type, SerializationContext out) {
        out.write("CAST(").dump(phrase.base()).write(" AS " + type + ")");
    }

    // ==================== Formulas ====================

    protected void dumpFormula(FormulaPhrase phrase, SerializationContext out) {
        int polarity = phrase.signature().polarity();
        switch (phrase.signature().kind()) {
            case IS_EQUAL:
                template(polarity > 0 ? "({lop} = {rop})" : "({lop} <> {rop})", phrase, out);
                break;
            case IS_TOTALLY_EQUAL:
                dumpIsTotallyEqual(phrase, out);
                break;
            case IS_IN:
                template("({lop} {not}IN (", phrase, out);
                out.union(phrase.arguments().list("rops"), ", ").write("))");
                break;
            case IS_NULL:
                template("({op} IS {not}NULL)", phrase, out);
                break;
            case IF_NULL:
                template("COALESCE({lop}, {rop})", phrase, out);
                break;
            case NULL_IF:
                template("NULLIF({lop}, {rop})", phrase, out);
                break;
            case COMPARE:
                template("({lop} " + phrase.signature().relation() + " {rop})", phrase, out);
                break;
            case AND:
                out.write("(").union(phrase.arguments().list("ops"), " AND ").write(")");
                break;
            case OR:
                out.write("(").union(phrase.arguments().list("ops"), " OR ").write(")");
                break;
            case NOT:
                template("(NOT {op})", phrase, out);
                break;
            case TO_PREDICATE:
                dumpToPredicate(phrase, out);
                break;
            case FROM_PREDICATE:
                dumpFromPredicate(phrase, out);
                break;
            case LIKE:
                dumpLike(phrase, out);
                break;
            case IF:
                dumpIf(phrase, out);
                break;
            case SWITCH:
                dumpSwitch(phrase, out);
                break;
            case ADD:
                template("({lop} + {rop})", phrase, out);
                break;
            case CONCATENATE:
                template("({lop} || {rop})", phrase, out);
                break;
            case DATE_INCREMENT:
            case DATE_DECREMENT:
            case DATE_DIFFERENCE:
                dumpDateArithmetic(phrase, out);
                break;
            case DATETIME_INCREMENT:
            case DATETIME_DECREMENT:
                dumpDateTimeArithmetic(phrase, out);
                break;
            case SUBTRACT:
                template("({lop} - {rop})", phrase, out);
                break;
            case MULTIPLY:
                template("({lop} * {rop})", phrase, out);
                break;
            case DIVIDE:
                template("({lop} / {rop})", phrase, out);
                break;
            case KEEP_POLARITY:
                template("{op}", phrase, out);
                break;
            case REVERSE_POLARITY:
                template("(- {op})", phrase, out);
                break;
            case ROUND:
                template("ROUND({op})", phrase, out);
                break;
            case ROUND_TO:
                template("ROUND({op}, {precision})", phrase, out);
                break;
            case TRUNC:
                template("TRUNC({op})", phrase, out);
                break;
            case TRUNC_TO:
                template("TRUNC({op}, {precision})", phrase, out);
                break;
            case LENGTH:
                dumpLength(phrase, out);
                break;
            case SUBSTRING:
                dumpSubstring(phrase, out);
                break;
            case REPLACE:
                template("REPLACE({op}, {old}, {new})", phrase, out);
                break;
            case UPPER:
                template("UPPER({op})", phrase, out);
                break;
            case LOWER:
                template("LOWER({op})", phrase, out);
                break;
            case TRIM:
                template("TRIM({op})", phrase, out);
                break;
            case LTRIM:
                template("LTRIM({op})", phrase, out);
                break;
            case RTRIM:
                template("RTRIM({op})", phrase, out);
                break;
            case TODAY:
                dumpToday(phrase, out);
                break;
            case NOW:
                out.write("LOCALTIMESTAMP");
                break;
            case MAKE_DATE:
                dumpMakeDate(phrase, out);
                break;
            case MAKE_DATETIME:
                dumpMakeDateTime(phrase, out);
                break;
            case COMBINE_DATETIME:
                dumpCombineDateTime(phrase, out);
                break;
            case EXTRACT_YEAR:
            case EXTRACT_MONTH:
            case EXTRACT_DAY:
            case EXTRACT_HOUR:
            case EXTRACT_MINUTE:
            case EXTRACT_SECOND:
                dumpExtract(phrase, phrase.signature().kind().name().substring("EXTRACT_".length()), out);
                break;
            case EXISTS:
                template("EXISTS {op}", phrase, out);
                break;
            case COUNT:
                template("COUNT({op})", phrase, out);
                break;
            case MIN_MAX:
                template(polarity > 0 ? "MIN({op})" : "MAX({op})", phrase, out);
                break;
            case SUM:
                template("SUM({op})", phrase, out);
                break;
            case AVG:
                template("AVG({op})", phrase, out);
                break;
            case ROWNUM:
                dumpRownum(phrase, out);
                break;
            default:
                throw new SerializeError("unable to serialize an operation " + phrase.signature(), phrase.mark());
        }
    }

    protected void dumpIsTotallyEqual(FormulaPhrase phrase, SerializationContext out) {
        if (phrase.signature().polarity() > 0) {
            template("(CASE WHEN (({lop} = {rop}) OR (({lop} IS NULL) AND ({rop} IS NULL)))"
                    + " THEN 1 ELSE 0 END)", phrase, out);
        } else {
            template("(CASE WHEN (({lop} <> {rop}) AND (({lop} IS NOT NULL) OR ({rop} IS NOT NULL)))"
                    + " THEN 1 ELSE 0 END)", phrase, out);
        }
    }

    protected void dumpToPredicate(FormulaPhrase phrase, SerializationContext out) {
        template("{op}", phrase, out);
    }

    protected void dumpFromPredicate(FormulaPhrase phrase, SerializationContext out) {
        template("{op}", phrase, out);
    }

    /**
     * Renders a case-insensitive match of a pattern that uses a backslash
     * as the escape character.
     */
    protected void dumpLike(FormulaPhrase phrase, SerializationContext out) {
        template("(UPPER({lop}) {not}LIKE UPPER({rop}) ESCAPE '\\')", phrase, out);
    }

    protected void dumpIf(FormulaPhrase phrase, SerializationContext out) {
        List<Phrase> predicates = phrase.arguments().list("predicates");
        List<Phrase> consequents = phrase.arguments().list("consequents");
        out.write("(CASE");
        for (int i = 0; i < predicates.size(); i++) {
            out.write(" WHEN ").dump(predicates.get(i)).write(" THEN ").dump(consequents.get(i));
        }
        dumpAlternative(phrase, out);
    }

    protected void dumpSwitch(FormulaPhrase phrase, SerializationContext out) {
        List<Phrase> variants = phrase.arguments().list("variants");
        List<Phrase> consequents = phrase.arguments().list("consequents");
        out.write("(CASE ").dump(phrase.get("variable"));
        for (int i = 0; i < variants.size(); i++) {
            out.write(" WHEN ").dump(variants.get(i)).write(" THEN ").dump(consequents.get(i));
        }
        dumpAlternative(phrase, out);
    }

    private static void dumpAlternative(FormulaPhrase phrase, SerializationContext out) {
        Phrase alternative = optional(phrase, "alternative");
        if (alternative != null) {
            out.write(" ELSE ").dump(alternative);
        }
        out.write(" END)");
    }

    protected void dumpDateArithmetic(FormulaPhrase phrase, SerializationContext out) {
        template(phrase.signature().is(SignatureKind.ADD) ? "({lop} + {rop})" : "({lop} - {rop})", phrase, out);
    }

    protected void dumpDateTimeArithmetic(FormulaPhrase phrase, SerializationContext out) {
        template(phrase.signature().is(SignatureKind.ADD)
                ? "({lop} + {rop} * INTERVAL '1' DAY)"
                : "({lop} - {rop} * INTERVAL '1' DAY)", phrase, out);
    }

    protected void dumpLength(FormulaPhrase phrase, SerializationContext out) {
        template("CHARACTER_LENGTH({op})", phrase, out);
    }

    protected void dumpSubstring(FormulaPhrase phrase, SerializationContext out) {
        if (optional(phrase, "length") == null) {
            template("SUBSTRING({op} FROM {start})", phrase, out);
        } else {
            template("SUBSTRING({op} FROM {start} FOR {length})", phrase, out);
        }
    }

    protected void dumpToday(FormulaPhrase phrase, SerializationContext out) {
        out.write("CURRENT_DATE");
    }

    protected void dumpMakeDate(FormulaPhrase phrase, SerializationContext out) {
        template("(DATE '2001-01-01' + ({year} - 2001) * INTERVAL '1' YEAR"
                + " + ({month} - 1) * INTERVAL '1' MONTH"
                + " + ({day} - 1) * INTERVAL '1' DAY)", phrase, out);
    }

    protected void dumpMakeDateTime(FormulaPhrase phrase, SerializationContext out) {
        out.write("(CAST(");
        dumpMakeDate(phrase, out);
        out.write(" AS TIMESTAMP)");
        for (String unit : List.of("hour", "minute", "second")) {
            Phrase value = optional(phrase, unit);
            if (value != null) {
                out.write(" + ").dump(value).write(" * INTERVAL '1' " + unit.toUpperCase(Locale.ROOT));
            }
        }
        out.write(")");
    }

    protected void dumpCombineDateTime(FormulaPhrase phrase, SerializationContext out) {
        template("(CAST({date} AS TIMESTAMP) + {time})", phrase, out);
    }

    protected void dumpExtract(FormulaPhrase phrase, String field, SerializationContext out) {
        out.write("EXTRACT(" + field + " FROM ").dump(phrase.get("op")).write(")");
    }

    protected void dumpRownum(FormulaPhrase phrase, SerializationContext out) {
        throw new SerializeError("row numbers are not supported by " + name(), phrase.mark());
    }

    // ==================== Templates ====================

    /**
     * Returns the argument in an optional slot, or null.
     */
    protected static Phrase optional(FormulaPhrase phrase, String name) {
        return phrase.arguments().has(name) ? phrase.get(name) : null;
    }

    /**
     * Writes a template, replacing {@code {slot}} with the argument in that
     * slot and {@code {not}} with the negation for negative polarity.
     */
    protected static void template(String template, FormulaPhrase phrase, SerializationContext out) {
        int start = 0;
        while (start < template.length()) {
            int open = template.indexOf('{', start);
            if (open < 0) {
                out.write(template.substring(start));
                break;
            }
            int close = template.indexOf('}', open);
            if (close < 0) {
                throw new IllegalArgumentException("unbalanced template: " + template);
            }
            out.write(template.substring(start, open));
            String name = template.substring(open + 1, close);
            if (name.equals("not")) {
                if (phrase.signature().polarity() < 0) {
                    out.write("NOT ");
                }
            } else {
                Phrase argument = phrase.get(name);
                if (argument == null) {
                    throw new SerializeError("missing argument " + name, phrase.mark());
                }
                out.dump(argument);
            }
            start = close + 1;
        }
    }
}
