package com.sievesql.functions;

import java.util.List;

/**
 * The closed set of operations a formula can express.
 *
 * <p>Kinds form a hierarchy: a kind declared with a parent inherits the
 * parent's slots unless it declares its own, and is accepted wherever the
 * parent is expected (see {@link #isSubkindOf}). Function correlation uses
 * this to let, for example, {@link #CONCATENATE} be found under {@link #ADD}.
 */
public enum SignatureKind {

    // ==================== Generic shapes ====================
    NULLARY(null),
    UNARY(null, Slot.of("op")),
    BINARY(null, Slot.of("lop"), Slot.of("rop")),
    NARY(null, Slot.of("lop"), Slot.plural("rops")),
    CONNECTIVE(null, Slot.plural("ops")),

    // ==================== Predicates ====================
    IS_EQUAL(BINARY),
    IS_TOTALLY_EQUAL(BINARY),
    IS_IN(NARY),
    IS_NULL(UNARY),
    IF_NULL(BINARY),
    NULL_IF(BINARY),
    COMPARE(BINARY),
    AND(CONNECTIVE),
    OR(CONNECTIVE),
    NOT(UNARY),
    TO_PREDICATE(UNARY),
    FROM_PREDICATE(UNARY),

    // ==================== Navigation macros ====================
    SORT_DIRECTION(null, Slot.of("base")),
    AS(null, Slot.of("base"), Slot.of("title")),
    LIMIT(null, Slot.of("limit"), Slot.optional("offset")),
    SORT(null, Slot.plural("order")),
    SELECT(null, Slot.optionalPlural("ops")),
    LINK(null, Slot.of("seed")),
    DEFINE(CONNECTIVE),
    WHERE(NARY),
    ROW_NUMBER(null, Slot.optionalPlural("partition"), Slot.optionalPlural("order")),
    ROWNUM(NULLARY),

    // ==================== Casts and constructors ====================
    CAST(null, Slot.of("base")),
    MAKE_DATE(null, Slot.of("year"), Slot.of("month"), Slot.of("day")),
    MAKE_DATETIME(null, Slot.of("year"), Slot.of("month"), Slot.of("day"),
            Slot.optional("hour"), Slot.optional("minute"), Slot.optional("second")),
    COMBINE_DATETIME(null, Slot.of("date"), Slot.of("time")),
    TODAY(NULLARY),
    NOW(NULLARY),

    // ==================== Extraction ====================
    EXTRACT(UNARY),
    EXTRACT_YEAR(EXTRACT),
    EXTRACT_MONTH(EXTRACT),
    EXTRACT_DAY(EXTRACT),
    EXTRACT_HOUR(EXTRACT),
    EXTRACT_MINUTE(EXTRACT),
    EXTRACT_SECOND(EXTRACT),

    // ==================== Arithmetic ====================
    ADD(BINARY),
    CONCATENATE(ADD),
    DATE_INCREMENT(ADD),
    DATETIME_INCREMENT(ADD),
    SUBTRACT(BINARY),
    DATE_DECREMENT(SUBTRACT),
    DATETIME_DECREMENT(SUBTRACT),
    DATE_DIFFERENCE(SUBTRACT),
    MULTIPLY(BINARY),
    DIVIDE(BINARY),
    KEEP_POLARITY(UNARY),
    REVERSE_POLARITY(UNARY),
    ROUND(UNARY),
    ROUND_TO(null, Slot.of("op"), Slot.of("precision")),
    TRUNC(UNARY),
    TRUNC_TO(null, Slot.of("op"), Slot.of("precision")),

    // ==================== Strings ====================
    LENGTH(UNARY),
    CONTAINS(BINARY),
    LIKE(BINARY),
    REPLACE(null, Slot.of("op"), Slot.of("old"), Slot.of("new")),
    SUBSTRING(null, Slot.of("op"), Slot.of("start"), Slot.optional("length")),
    HEAD(null, Slot.of("op"), Slot.optional("length")),
    TAIL(null, Slot.of("op"), Slot.optional("length")),
    SLICE(null, Slot.of("op"), Slot.optional("left"), Slot.optional("right")),
    AT(null, Slot.of("op"), Slot.of("index"), Slot.optional("length")),
    UPPER(UNARY),
    LOWER(UNARY),
    TRIM(UNARY),
    LTRIM(TRIM),
    RTRIM(TRIM),

    // ==================== Conditionals ====================
    IF(null, Slot.plural("predicates"), Slot.plural("consequents"), Slot.optional("alternative")),
    SWITCH(null, Slot.of("variable"), Slot.plural("variants"), Slot.plural("consequents"),
            Slot.optional("alternative")),

    // ==================== Aggregates ====================
    AGGREGATE(null, Slot.optional("plural_base"), Slot.of("op")),
    QUANTIFY(AGGREGATE),
    EXISTS(UNARY),
    COUNT(UNARY),
    MIN_MAX(UNARY),
    SUM(UNARY),
    AVG(UNARY);

    private final SignatureKind parent;
    private final List<Slot> slots;

    SignatureKind(SignatureKind parent, Slot... slots) {
        this.parent = parent;
        if (slots.length == 0 && parent != null) {
            this.slots = parent.slots;
        } else {
            this.slots = List.of(slots);
        }
    }

    public SignatureKind parent() {
        return parent;
    }

    public List<Slot> slots() {
        return slots;
    }

    /**
     * Returns true if this kind is {@code other} or descends from it.
     */
    public boolean isSubkindOf(SignatureKind other) {
        for (SignatureKind kind = this; kind != null; kind = kind.parent) {
            if (kind == other) {
                return true;
            }
        }
        return false;
    }
}
