package com.sievesql.generator;

import com.sievesql.compiler.LimitOffsetPagination;
import com.sievesql.compiler.PaginationStrategy;
import com.sievesql.frame.FormulaPhrase;
import com.sievesql.frame.LiteralPhrase;
import com.sievesql.functions.SignatureKind;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * PostgreSQL rendering.
 *
 * <p>PostgreSQL has a native Boolean type, {@code LIMIT}/{@code OFFSET}
 * and {@code IS DISTINCT FROM}, and accepts a {@code SELECT} without
 * {@code FROM}. Identifiers are truncated at 63 bytes.
 */
public class PostgresDialect extends Dialect {

    public static final String NAME = "postgresql";

    private static final PaginationStrategy PAGINATION = new LimitOffsetPagination();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int maxAliasLength() {
        return 63;
    }

    @Override
    public PaginationStrategy paginationStrategy() {
        return PAGINATION;
    }

    @Override
    public boolean hasBooleanValues() {
        return true;
    }

    // ==================== Literals ====================

    @Override
    protected void dumpBoolean(boolean value, SerializationContext out) {
        out.write(value ? "TRUE" : "FALSE");
    }

    @Override
    protected void dumpDecimal(BigDecimal value, SerializationContext out) {
        if (value.signum() < 0) {
            out.write("'" + value.toPlainString() + "'::NUMERIC");
        } else {
            out.write(value.toPlainString() + "::NUMERIC");
        }
    }

    @Override
    protected void dumpFloat(double value, SerializationContext out) {
        out.write(Double.toString(value) + "::FLOAT8");
    }

    @Override
    protected void dumpText(LiteralPhrase phrase, String value, SerializationContext out) {
        if (value.indexOf('\\') >= 0) {
            out.write("E").literal(value.replace("\\", "\\\\"), phrase);
        } else {
            out.literal(value, phrase);
        }
    }

    @Override
    protected void dumpTemporal(LiteralPhrase phrase, String type, String value, SerializationContext out) {
        out.literal(value, phrase).write("::" + type);
    }

    // ==================== Formulas ====================

    @Override
    protected void dumpIsTotallyEqual(FormulaPhrase phrase, SerializationContext out) {
        if (phrase.signature().polarity() > 0) {
            template("({lop} IS NOT DISTINCT FROM {rop})", phrase, out);
        } else {
            template("({lop} IS DISTINCT FROM {rop})", phrase, out);
        }
    }

    @Override
    protected void dumpLike(FormulaPhrase phrase, SerializationContext out) {
        template("({lop} {not}ILIKE {rop})", phrase, out);
    }

    @Override
    protected void dumpDateTimeArithmetic(FormulaPhrase phrase, SerializationContext out) {
        template(phrase.signature().is(SignatureKind.ADD)
                ? "({lop} + {rop} * '1 DAY'::INTERVAL)"
                : "({lop} - {rop} * '1 DAY'::INTERVAL)", phrase, out);
    }

    @Override
    protected void dumpMakeDate(FormulaPhrase phrase, SerializationContext out) {
        template("CAST('0001-01-01'::DATE"
                + " + ({year} - 1) * '1 YEAR'::INTERVAL"
                + " + ({month} - 1) * '1 MONTH'::INTERVAL"
                + " + ({day} - 1) * '1 DAY'::INTERVAL"
                + " AS DATE)", phrase, out);
    }

    @Override
    protected void dumpMakeDateTime(FormulaPhrase phrase, SerializationContext out) {
        out.write("(CAST(");
        dumpMakeDate(phrase, out);
        out.write(" AS TIMESTAMP)");
        for (String unit : new String[] {"hour", "minute", "second"}) {
            if (optional(phrase, unit) != null) {
                out.write(" + ").dump(phrase.get(unit))
                        .write(" * '1 " + unit.toUpperCase(Locale.ROOT) + "'::INTERVAL");
            }
        }
        out.write(")");
    }

    @Override
    protected void dumpCombineDateTime(FormulaPhrase phrase, SerializationContext out) {
        template("({date} + {time})", phrase, out);
    }

    @Override
    protected void dumpExtract(FormulaPhrase phrase, String field, SerializationContext out) {
        if (phrase.signature().kind() == SignatureKind.EXTRACT_SECOND) {
            out.write("CAST(EXTRACT(SECOND FROM ").dump(phrase.get("op")).write(") AS DOUBLE PRECISION)");
        } else {
            out.write("CAST(EXTRACT(" + field + " FROM ").dump(phrase.get("op")).write(") AS INTEGER)");
        }
    }
}
