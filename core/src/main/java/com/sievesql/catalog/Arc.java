package com.sievesql.catalog;

/**
 * What an attribute name refers to: a table (from the home scope), a column,
 * a chain of joins, or a set of ambiguous alternatives.
 */
public sealed interface Arc permits TableArc, ColumnArc, ChainArc, AmbiguousArc {
}
