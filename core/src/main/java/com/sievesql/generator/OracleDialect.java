package com.sievesql.generator;

import com.sievesql.compiler.PaginationStrategy;
import com.sievesql.compiler.RownumPagination;
import com.sievesql.exception.SerializeError;
import com.sievesql.frame.BranchFrame;
import com.sievesql.frame.CastPhrase;
import com.sievesql.frame.FormulaPhrase;
import com.sievesql.frame.Frame;
import com.sievesql.frame.LiteralPhrase;
import com.sievesql.frame.Phrase;
import com.sievesql.frame.ScalarFrame;
import com.sievesql.functions.SignatureKind;
import com.sievesql.types.BooleanDomain;
import com.sievesql.types.DateDomain;
import com.sievesql.types.DateTimeDomain;
import com.sievesql.types.DecimalDomain;
import com.sievesql.types.Domain;
import com.sievesql.types.FloatDomain;
import com.sievesql.types.TextDomain;
import com.sievesql.types.TimeDomain;

import java.math.BigInteger;
import java.util.List;

/**
 * Oracle rendering.
 *
 * <p>Oracle has no Boolean values: a condition used as a value becomes a
 * {@code CASE} expression producing {@code 1} or {@code 0}, and a value
 * used as a condition is compared with {@code 0}. A query without a table
 * reads from {@code DUAL}. Rows are sliced with {@code ROWNUM} filters.
 * Identifiers are limited to 30 characters.
 */
public class OracleDialect extends Dialect {

    public static final String NAME = "oracle";

    private static final PaginationStrategy PAGINATION = new RownumPagination();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int maxAliasLength() {
        return 30;
    }

    @Override
    public PaginationStrategy paginationStrategy() {
        return PAGINATION;
    }

    @Override
    public boolean hasBooleanValues() {
        return false;
    }

    // ==================== Frames ====================

    @Override
    protected void dumpScalar(ScalarFrame frame, SerializationContext out) {
        out.write("DUAL");
    }

    @Override
    protected void dumpFrameAlias(String alias, Frame frame, SerializationContext out) {
        if (frame instanceof ScalarFrame) {
            return;
        }
        out.write(" ").name(alias, frame);
    }

    @Override
    protected void dumpGroup(BranchFrame frame, SerializationContext out) {
        List<Phrase> group = frame.group().stream()
                .filter(phrase -> !(phrase instanceof LiteralPhrase))
                .toList();
        if (group.isEmpty()) {
            return;
        }
        out.newline();
        out.write("GROUP BY ").union(group, ", ");
    }

    @Override
    protected void dumpLimit(BranchFrame frame, SerializationContext out) {
        if (frame.isSliced()) {
            throw new SerializeError("LIMIT and OFFSET are not supported by " + NAME, frame.mark());
        }
    }

    // ==================== Literals ====================

    @Override
    protected void dumpBoolean(boolean value, SerializationContext out) {
        out.write(value ? "1" : "0");
    }

    @Override
    protected void dumpInteger(LiteralPhrase phrase, BigInteger value, SerializationContext out) {
        out.write(value.toString());
    }

    @Override
    protected void dumpFloat(double value, SerializationContext out) {
        out.write(Double.toString(value) + "D");
    }

    @Override
    protected void dumpTemporal(LiteralPhrase phrase, String type, String value, SerializationContext out) {
        if (type.equals("TIME")) {
            out.write("INTERVAL ").literal(value, phrase).write(" HOUR TO SECOND");
        } else {
            super.dumpTemporal(phrase, type, value, out);
        }
    }

    // ==================== Casts ====================

    @Override
    protected void dumpCast(CastPhrase phrase, SerializationContext out) {
        Domain origin = phrase.base().domain();
        Domain domain = phrase.domain();
        if (domain instanceof FloatDomain) {
            cast(phrase, "BINARY_DOUBLE", out);
        } else if (domain instanceof DecimalDomain) {
            cast(phrase, "NUMBER", out);
        } else if (domain instanceof TextDomain) {
            dumpToText(phrase, origin, out);
        } else if (domain instanceof DateDomain && origin instanceof TextDomain) {
            out.write("TO_DATE(").dump(phrase.base()).write(", 'YYYY-MM-DD')");
        } else if (domain instanceof DateDomain && origin instanceof DateTimeDomain) {
            out.write("TRUNC(").dump(phrase.base()).write(", 'DD')");
        } else if (domain instanceof TimeDomain && origin instanceof TextDomain) {
            out.write("TO_DSINTERVAL('0 ' || ").dump(phrase.base()).write(")");
        } else if (domain instanceof TimeDomain && origin instanceof DateTimeDomain) {
            out.write("(").dump(phrase.base()).write(" - TRUNC(").dump(phrase.base()).write(", 'DD'))");
        } else if (domain instanceof DateTimeDomain && origin instanceof TextDomain) {
            out.write("TO_TIMESTAMP(").dump(phrase.base()).write(", 'YYYY-MM-DD HH24:MI:SS')");
        } else {
            super.dumpCast(phrase, out);
        }
    }

    private void dumpToText(CastPhrase phrase, Domain origin, SerializationContext out) {
        Phrase base = phrase.base();
        if (origin instanceof BooleanDomain) {
            out.write("(CASE WHEN ").dump(base).write(" <> 0 THEN 'true'");
            if (base.isNullable()) {
                out.write(" WHEN NOT ").dump(base).write(" = 0 THEN 'false' END)");
            } else {
                out.write(" ELSE 'false' END)");
            }
        } else if (origin instanceof DateDomain) {
            out.write("TO_CHAR(").dump(base).write(", 'YYYY-MM-DD')");
        } else if (origin instanceof TimeDomain) {
            out.write("TO_CHAR(TIMESTAMP '2001-01-01 00:00:00' + ").dump(base).write(", 'HH24:MI:SS.FF')");
        } else if (origin instanceof DateTimeDomain) {
            out.write("TO_CHAR(").dump(base).write(", 'YYYY-MM-DD HH24:MI:SS.FF')");
        } else {
            out.write("TO_CHAR(").dump(base).write(")");
        }
    }

    // ==================== Formulas ====================

    @Override
    protected void dumpToPredicate(FormulaPhrase phrase, SerializationContext out) {
        template("({op} <> 0)", phrase, out);
    }

    @Override
    protected void dumpFromPredicate(FormulaPhrase phrase, SerializationContext out) {
        if (phrase.isNullable()) {
            template("(CASE WHEN {op} THEN 1 WHEN NOT {op} THEN 0 END)", phrase, out);
        } else {
            template("(CASE WHEN {op} THEN 1 ELSE 0 END)", phrase, out);
        }
    }

    @Override
    protected void dumpIsTotallyEqual(FormulaPhrase phrase, SerializationContext out) {
        template("((CASE WHEN ({lop} = {rop}) OR ({lop} IS NULL AND {rop} IS NULL) THEN 1 ELSE 0 END)"
                + (phrase.signature().polarity() > 0 ? " <> 0)" : " = 0)"), phrase, out);
    }

    @Override
    protected void dumpRownum(FormulaPhrase phrase, SerializationContext out) {
        out.write("ROWNUM");
    }

    @Override
    protected void dumpLength(FormulaPhrase phrase, SerializationContext out) {
        template("LENGTH({op})", phrase, out);
    }

    @Override
    protected void dumpSubstring(FormulaPhrase phrase, SerializationContext out) {
        if (optional(phrase, "length") == null) {
            template("SUBSTR({op}, {start})", phrase, out);
        } else {
            template("SUBSTR({op}, {start}, {length})", phrase, out);
        }
    }

    @Override
    protected void dumpDateTimeArithmetic(FormulaPhrase phrase, SerializationContext out) {
        template(phrase.signature().is(SignatureKind.ADD)
                ? "({lop} + NUMTODSINTERVAL({rop}, 'DAY'))"
                : "({lop} - NUMTODSINTERVAL({rop}, 'DAY'))", phrase, out);
    }

    @Override
    protected void dumpToday(FormulaPhrase phrase, SerializationContext out) {
        out.write("TRUNC(CURRENT_DATE)");
    }

    @Override
    protected void dumpExtract(FormulaPhrase phrase, String field, SerializationContext out) {
        if (phrase.signature().kind() == SignatureKind.EXTRACT_SECOND) {
            out.write("(1D * EXTRACT(SECOND FROM ").dump(phrase.get("op")).write("))");
        } else {
            super.dumpExtract(phrase, field, out);
        }
    }
}
